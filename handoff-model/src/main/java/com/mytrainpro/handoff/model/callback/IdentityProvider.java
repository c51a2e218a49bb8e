package com.mytrainpro.handoff.model.callback;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identity providers whose tokens the OAuth callback accepts.
 */
public enum IdentityProvider {
  GOOGLE("google"),
  APPLE("apple");

  private final String wireValue;

  IdentityProvider(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }
}
