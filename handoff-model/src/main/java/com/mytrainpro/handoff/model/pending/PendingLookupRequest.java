package com.mytrainpro.handoff.model.pending;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model the app sends when it regains foreground and asks whether a login completed in the
 * browser for this install.
 * <p>
 * Used by: {@code POST /auth/pending/lookup}
 *
 * @param deviceId opaque per-install identifier
 */
public record PendingLookupRequest(
    @JsonProperty("deviceId") String deviceId) {
}
