package com.mytrainpro.handoff.server.store;

import java.time.Instant;

/**
 * Short-lived record bridging identity verification in the browser to session pickup in the app.
 *
 * @param deviceId      per-install identifier, the lookup key
 * @param sessionHandle opaque handle identifying this record; travels in the deep link
 * @param userId        principal established by identity verification
 * @param createdAt     when the record was created
 * @param expiresAt     when the record lapses; pulled forward to "now" when superseded
 * @param consumedAt    when the record was consumed, or null while unconsumed
 */
public record PendingSession(
    String deviceId,
    String sessionHandle,
    String userId,
    Instant createdAt,
    Instant expiresAt,
    Instant consumedAt) {

  public boolean isConsumed() {
    return consumedAt != null;
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  /**
   * A record can be looked up and consumed only while unconsumed and unexpired.
   *
   * @param now current time
   * @return true if live
   */
  public boolean isLive(Instant now) {
    return !isConsumed() && !isExpired(now);
  }

  PendingSession withConsumedAt(Instant now) {
    return new PendingSession(deviceId, sessionHandle, userId, createdAt, expiresAt, now);
  }

  PendingSession withExpiresAt(Instant now) {
    return new PendingSession(deviceId, sessionHandle, userId, createdAt, now, consumedAt);
  }
}
