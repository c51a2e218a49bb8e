package com.mytrainpro.handoff.model.pending;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.time.Instant;

/**
 * Wire model for the ordinary authenticated application session produced by a successful
 * handoff.
 * <p>
 * The app installs it into its WebView cookie store (see {@link #cookieHeader(Instant)}) or sends
 * the token as a bearer credential.
 *
 * @param sessionId  identifier of the session on the server
 * @param token      signed bearer token for the session
 * @param userId     user the session is for
 * @param cookieName name of the session cookie the web app expects
 * @param expiresAt  instant the session stops being accepted
 */
public record AppSession(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("token") String token,
    @JsonProperty("userId") String userId,
    @JsonProperty("cookieName") String cookieName,
    @JsonProperty("expiresAt") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant expiresAt) {

  /**
   * Renders the session as a {@code Set-Cookie} style header value.
   *
   * @param now current time, used to compute {@code Max-Age}
   * @return the cookie string
   */
  public String cookieHeader(Instant now) {
    long maxAge = Math.max(0, Duration.between(now, expiresAt).getSeconds());
    return cookieName + "=" + token + "; Path=/; Max-Age=" + maxAge + "; SameSite=Lax; Secure";
  }
}
