package com.mytrainpro.handoff.server.store;

import com.mytrainpro.handoff.model.LogMasks;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired sessions are lazily evicted on {@link #load}. All sessions are lost on
 * server restart. Suitable for development and integration testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, SessionData> store = new ConcurrentHashMap<>();

  @Override
  public void store(String sessionId, SessionData sessionData) {
    store.put(sessionId, sessionData);
    log.debug("Stored session id={}", LogMasks.mask(sessionId));
  }

  @Override
  public Optional<SessionData> load(String sessionId) {
    SessionData data = store.get(sessionId);
    if (data == null) {
      return Optional.empty();
    }
    if (data.expiresAt().isBefore(Instant.now())) {
      store.remove(sessionId);
      return Optional.empty();
    }
    return Optional.of(data);
  }

  @Override
  public void revoke(String sessionId) {
    store.remove(sessionId);
    log.debug("Revoked session id={}", LogMasks.mask(sessionId));
  }
}
