package com.mytrainpro.handoff.model.pending;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model asking the server to consume a pending session and materialize the app session.
 * <p>
 * Used by: {@code POST /auth/pending/consume}
 *
 * @param sessionHandle handle received via deep link or lookup
 */
public record PendingConsumeRequest(
    @JsonProperty("sessionHandle") String sessionHandle) {
}
