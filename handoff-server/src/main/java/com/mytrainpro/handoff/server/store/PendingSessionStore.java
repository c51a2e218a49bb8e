package com.mytrainpro.handoff.server.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage abstraction for pending sessions.
 * <p>
 * Implementations must be thread-safe.
 * <p>
 * <strong>Consumption contract:</strong> {@link #consume(String)} must be linearizable per
 * session handle. When the deep link and the app's foreground poll race each other, the two
 * consume calls for one handle must resolve to exactly one {@link ConsumeResult.Outcome#CONSUMED}
 * and every other caller must observe {@link ConsumeResult.Outcome#ALREADY_CONSUMED}. A database
 * implementation typically uses a conditional update
 * ({@code UPDATE ... SET consumed_at = ? WHERE handle = ? AND consumed_at IS NULL}).
 * <p>
 * <strong>Supersede contract:</strong> after {@link #create(String, String)} returns, the device
 * has exactly one live record. Earlier unconsumed records for the device are expired, not deleted,
 * so that consuming them reports {@link ConsumeResult.Outcome#EXPIRED}.
 */
public interface PendingSessionStore {

  /**
   * Creates a pending session for the device, superseding any earlier live one.
   *
   * @param deviceId per-install identifier
   * @param userId   verified principal
   * @return the new record
   * @throws IllegalStateException if the store is at capacity
   */
  PendingSession create(String deviceId, String userId);

  /**
   * Returns the device's live pending session. Consumed, expired and superseded records are
   * reported as absent.
   *
   * @param deviceId per-install identifier
   * @return the live record, or empty
   */
  Optional<PendingSession> lookup(String deviceId);

  /**
   * Atomically marks the record consumed if it is still live.
   *
   * @param sessionHandle handle of the record
   * @return the outcome
   */
  ConsumeResult consume(String sessionHandle);

  /**
   * Removes every record whose {@code expiresAt} lies before the cutoff, consumed or not.
   *
   * @param cutoff removal threshold
   * @return number of records removed
   */
  int purgeExpired(Instant cutoff);

  /**
   * Number of records currently held, live or retained.
   *
   * @return the record count
   */
  int size();
}
