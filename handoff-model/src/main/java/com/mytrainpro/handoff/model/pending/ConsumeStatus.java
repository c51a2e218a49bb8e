package com.mytrainpro.handoff.model.pending;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a consume call as it appears on the wire.
 */
public enum ConsumeStatus {

  /**
   * This call won; an app session was issued.
   */
  OK("ok"),

  /**
   * Another call already completed the handoff. Not a failure and not retryable.
   */
  ALREADY_CONSUMED("already_consumed"),

  /**
   * The record outlived its TTL or was superseded by a newer login. The user must sign in again.
   */
  EXPIRED("expired"),

  /**
   * No such handle was ever issued; points at a corrupted or forged deep link.
   */
  NOT_FOUND("not_found");

  private final String wireValue;

  ConsumeStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  /**
   * Lower-case value used in JSON.
   *
   * @return the wire value
   */
  @JsonValue
  public String wireValue() {
    return wireValue;
  }
}
