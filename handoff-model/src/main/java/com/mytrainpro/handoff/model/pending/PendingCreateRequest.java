package com.mytrainpro.handoff.model.pending;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model asking the server to open a pending session for a device once the identity provider
 * has vouched for the user.
 * <p>
 * Internal endpoint; normally reached only from the OAuth callback handler.
 * <p>
 * Used by: {@code POST /auth/pending/create}
 *
 * @param deviceId opaque per-install identifier generated by the app
 * @param userId   principal established by identity verification
 */
public record PendingCreateRequest(
    @JsonProperty("deviceId") String deviceId,
    @JsonProperty("userId") String userId) {
}
