package com.mytrainpro.handoff.dropwizard.auth;

import com.mytrainpro.handoff.server.auth.AppSessionManager;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that validates app session bearer tokens using
 * {@link AppSessionManager}.
 */
public class HandoffAuthenticator implements Authenticator<String, HandoffPrincipal> {

  private final AppSessionManager appSessionManager;

  public HandoffAuthenticator(AppSessionManager appSessionManager) {
    this.appSessionManager = appSessionManager;
  }

  @Override
  public Optional<HandoffPrincipal> authenticate(String token) throws AuthenticationException {
    return appSessionManager.verify(token)
        .map(result -> new HandoffPrincipal(result.userId(), result.sessionId()));
  }
}
