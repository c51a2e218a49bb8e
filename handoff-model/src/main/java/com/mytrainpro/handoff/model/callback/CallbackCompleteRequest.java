package com.mytrainpro.handoff.model.callback;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model sent by the browser-side OAuth callback once the identity provider returned a token.
 * <p>
 * Used by: {@code POST /auth/callback/complete}
 *
 * @param deviceId device the login was started from (passed through the OAuth state)
 * @param provider identity provider that issued the token
 * @param idToken  identity token to verify
 */
public record CallbackCompleteRequest(
    @JsonProperty("deviceId") String deviceId,
    @JsonProperty("provider") IdentityProvider provider,
    @JsonProperty("idToken") String idToken) {
}
