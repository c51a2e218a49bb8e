package com.mytrainpro.handoff.model.callback;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Wire model returned to the browser after the callback created a pending session. The browser
 * navigates to {@code deepLink} to hand control back to the app.
 * <p>
 * Used by: {@code POST /auth/callback/complete} response
 *
 * @param sessionHandle handle of the new pending session
 * @param expiresAt     when the pending session lapses
 * @param deepLink      application-scheme URL carrying the handle
 */
public record CallbackCompleteResponse(
    @JsonProperty("sessionHandle") String sessionHandle,
    @JsonProperty("expiresAt") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant expiresAt,
    @JsonProperty("deepLink") String deepLink) {
}
