package com.mytrainpro.handoff.server.store;

import java.util.Optional;

/**
 * Storage abstraction for issued application sessions, keyed by session id.
 * <p>
 * Implementations must be thread-safe. A session that is absent here is treated as revoked even
 * if its token is otherwise valid.
 */
public interface SessionStore {

  /**
   * Stores session data keyed by session id.
   *
   * @param sessionId   unique session identifier (the token's JTI)
   * @param sessionData session data to store
   */
  void store(String sessionId, SessionData sessionData);

  /**
   * Loads session data by session id, returning empty if not found or expired.
   *
   * @param sessionId unique session identifier
   * @return the session data, or empty if not found or expired
   */
  Optional<SessionData> load(String sessionId);

  /**
   * Revokes a single session.
   *
   * @param sessionId unique session identifier
   */
  void revoke(String sessionId);
}
