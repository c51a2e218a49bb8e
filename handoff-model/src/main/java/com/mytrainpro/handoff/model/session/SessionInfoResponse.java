package com.mytrainpro.handoff.model.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model describing the caller's authenticated app session.
 * <p>
 * Used by: {@code GET /auth/session} response
 *
 * @param userId    the signed-in user
 * @param sessionId the app session id
 */
public record SessionInfoResponse(
    @JsonProperty("userId") String userId,
    @JsonProperty("sessionId") String sessionId) {
}
