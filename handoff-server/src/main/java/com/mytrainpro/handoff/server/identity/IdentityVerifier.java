package com.mytrainpro.handoff.server.identity;

import com.mytrainpro.handoff.model.callback.IdentityProvider;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies an identity-provider token and maps it to an application user.
 * <p>
 * Implementations validate the token signature, issuer and audience for the given provider
 * (Google and Apple publish JWKS endpoints for this) and find or create the matching user. How
 * that happens is outside the handoff protocol; only the resulting user id matters here.
 * Implementations must be thread-safe.
 */
@FunctionalInterface
public interface IdentityVerifier {

  /**
   * Verifies the token.
   *
   * @param provider the provider that issued the token
   * @param idToken  the raw token
   * @return the user id, or empty if the token is not acceptable
   */
  Optional<String> verify(IdentityProvider provider, String idToken);

  /**
   * A verifier that rejects every token. Used when no verifier was supplied, so the callback
   * endpoint fails closed.
   *
   * @return the rejecting verifier
   */
  static IdentityVerifier rejectingAll() {
    Logger log = LoggerFactory.getLogger(IdentityVerifier.class);
    return (provider, idToken) -> {
      log.warn("No identity verifier configured; rejecting {} token", provider);
      return Optional.empty();
    };
  }
}
