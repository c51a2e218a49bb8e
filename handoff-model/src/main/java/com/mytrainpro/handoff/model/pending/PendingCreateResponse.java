package com.mytrainpro.handoff.model.pending;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Wire model returned after a pending session was created.
 * <p>
 * Used by: {@code POST /auth/pending/create} response
 *
 * @param sessionHandle opaque handle identifying the pending record; embedded in the deep link
 * @param expiresAt     instant after which the record can no longer be looked up or consumed
 */
public record PendingCreateResponse(
    @JsonProperty("sessionHandle") String sessionHandle,
    @JsonProperty("expiresAt") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant expiresAt) {
}
