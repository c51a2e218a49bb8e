package com.mytrainpro.handoff.server.store;

import java.time.Instant;

/**
 * Data stored for an issued application session.
 *
 * @param userId    user the session belongs to
 * @param issuedAt  when the session was created
 * @param expiresAt when the session expires
 */
public record SessionData(
    String userId,
    Instant issuedAt,
    Instant expiresAt) {
}
