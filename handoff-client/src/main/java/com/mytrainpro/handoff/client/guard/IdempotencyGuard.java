package com.mytrainpro.handoff.client.guard;

import com.mytrainpro.handoff.client.storage.DurableKeyValueStore;
import com.mytrainpro.handoff.model.LogMasks;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remembers the last session handle the client started to materialize so that repeated
 * deep-link deliveries and a concurrent poller hit cannot process one handle twice.
 * <p>
 * The marker is written before the consume request is sent. If the app dies between marking and
 * the response, that handle stays blocked on this device; a new login yields a new handle. The
 * marker is cleared only by {@link #clear()} on explicit logout.
 */
@Singleton
public class IdempotencyGuard {

  private static final Logger log = LoggerFactory.getLogger(IdempotencyGuard.class);

  static final String MARKER_KEY = "handoff.lastProcessedSessionHandle";

  private final DurableKeyValueStore store;

  @Inject
  public IdempotencyGuard(final DurableKeyValueStore store) {
    this.store = store;
  }

  /**
   * @param sessionHandle candidate handle
   * @return true if the handle differs from the stored marker
   */
  public synchronized boolean shouldProcess(final String sessionHandle) {
    return !store.get(MARKER_KEY).map(sessionHandle::equals).orElse(false);
  }

  /**
   * Durably records the handle as being processed.
   *
   * @param sessionHandle the handle about to be consumed
   */
  public synchronized void markProcessing(final String sessionHandle) {
    store.put(MARKER_KEY, sessionHandle);
  }

  /**
   * Check and mark in one step. Exactly one of several concurrent callers with the same handle
   * gets {@code true}.
   *
   * @param sessionHandle candidate handle
   * @return true if the caller should go on to consume the handle
   */
  public synchronized boolean tryBegin(final String sessionHandle) {
    if (!shouldProcess(sessionHandle)) {
      log.debug("Handle={} already processed on this device", LogMasks.mask(sessionHandle));
      return false;
    }
    markProcessing(sessionHandle);
    return true;
  }

  /**
   * @return the stored marker, if any
   */
  public synchronized Optional<String> lastProcessed() {
    return store.get(MARKER_KEY);
  }

  /**
   * Forgets the marker. Called on explicit logout only.
   */
  public synchronized void clear() {
    store.remove(MARKER_KEY);
    log.debug("Cleared processed-session marker");
  }
}
