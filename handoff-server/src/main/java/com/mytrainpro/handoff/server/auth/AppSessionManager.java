package com.mytrainpro.handoff.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.mytrainpro.handoff.model.LogMasks;
import com.mytrainpro.handoff.model.pending.AppSession;
import com.mytrainpro.handoff.server.store.SessionData;
import com.mytrainpro.handoff.server.store.SessionStore;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies the application's ordinary authenticated sessions.
 * <p>
 * A session is an HMAC-SHA256 signed JWT whose JTI is the session id. Each session id is stored
 * in a {@link SessionStore} so that sessions can be revoked before expiry (logout).
 */
public class AppSessionManager {

  private static final Logger log = LoggerFactory.getLogger(AppSessionManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final SessionStore sessionStore;
  private final String issuer;
  private final Duration ttl;
  private final String cookieName;

  /**
   * Creates a new AppSessionManager.
   *
   * @param secret       HMAC-SHA256 signing secret
   * @param issuer       JWT issuer claim
   * @param ttl          session lifetime
   * @param cookieName   name of the session cookie the web app reads
   * @param sessionStore backing store for session data and revocation
   */
  public AppSessionManager(byte[] secret, String issuer, Duration ttl, String cookieName,
                           SessionStore sessionStore) {
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = JWT.require(algorithm).withIssuer(issuer).build();
    this.sessionStore = sessionStore;
    this.issuer = issuer;
    this.ttl = ttl;
    this.cookieName = cookieName;
  }

  /**
   * Issues a session for a user whose pending session was just consumed.
   *
   * @param userId the user
   * @return the session credentials handed to the app
   */
  public AppSession issue(String userId) {
    String sessionId = UUID.randomUUID().toString();
    Instant now = Instant.now();
    Instant expiresAt = now.plus(ttl);

    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(sessionId)
        .withSubject(userId)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);

    sessionStore.store(sessionId, new SessionData(userId, now, expiresAt));
    log.debug("Issued app session id={}", LogMasks.mask(sessionId));
    return new AppSession(sessionId, token, userId, cookieName, expiresAt);
  }

  /**
   * Result of a successful token verification.
   *
   * @param userId    the JWT subject
   * @param sessionId the JWT ID
   */
  public record VerifyResult(String userId, String sessionId) {
  }

  /**
   * Verifies a token and returns the user and session id if valid and not revoked.
   *
   * @param token JWT string
   * @return verify result if valid, empty if invalid or revoked
   */
  public Optional<VerifyResult> verify(String token) {
    try {
      DecodedJWT decoded = verifier.verify(token);
      String sessionId = decoded.getId();
      if (sessionStore.load(sessionId).isEmpty()) {
        log.debug("Session id={} not found in session store (revoked or expired)", LogMasks.mask(sessionId));
        return Optional.empty();
      }
      return Optional.of(new VerifyResult(decoded.getSubject(), sessionId));
    } catch (JWTVerificationException e) {
      log.debug("Session token verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Revokes a session by id.
   *
   * @param sessionId the session id
   */
  public void revoke(String sessionId) {
    sessionStore.revoke(sessionId);
  }
}
