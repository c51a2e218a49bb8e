package com.mytrainpro.handoff.springboot.security;

import java.security.Principal;

/**
 * Authenticated app session, as placed in the security context by
 * {@link SessionTokenAuthenticationFilter}. Inject it with {@code @AuthenticationPrincipal}.
 *
 * @param userId    user the session was issued to
 * @param sessionId session id (token JTI); revoking it logs the session out
 */
public record HandoffPrincipal(String userId, String sessionId) implements Principal {

  @Override
  public String getName() {
    return userId;
  }
}
