package com.mytrainpro.handoff.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing a user signed in through an app session.
 *
 * @param userId    user id from the token subject
 * @param sessionId session id (token JTI), used for logout
 */
public record HandoffPrincipal(String userId, String sessionId) implements Principal {

  @Override
  public String getName() {
    return userId;
  }
}
