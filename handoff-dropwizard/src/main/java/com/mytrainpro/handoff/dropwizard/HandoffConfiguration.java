package com.mytrainpro.handoff.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for the pending-session handoff.
 * <p>
 * For production, supply {@code sessionSecretHex} (hex-encoded, at least 32 bytes) so that
 * issued app sessions survive restarts. Omitting it causes a random secret to be generated on
 * each startup (dev/test only).
 * <p>
 * Generate a secret with: {@code openssl rand -hex 32}
 */
public class HandoffConfiguration extends Configuration {

  /**
   * Lifetime of a pending session, from callback completion to consumption.
   */
  @Min(1)
  private long pendingTtlSeconds = 300;

  /**
   * How long expired and consumed pending sessions are kept so that late consumers get
   * {@code already_consumed} or {@code expired} instead of {@code not_found}.
   */
  @Min(0)
  private long pendingRetentionSeconds = 600;

  /**
   * Cap on retained pending sessions. Creation beyond it answers HTTP 503.
   */
  @Min(1)
  private int maxPendingSessions = 10_000;

  /**
   * Scheme of the deep link the browser opens after the OAuth callback.
   */
  @NotEmpty
  private String deepLinkScheme = "mytrainpro";

  /**
   * Hex-encoded HMAC-SHA256 signing secret for app session tokens.
   * Leave empty for random generation (dev only; sessions become invalid on restart).
   */
  private String sessionSecretHex = "";

  /**
   * App session time-to-live in seconds.
   */
  @Min(1)
  private long sessionTtlSeconds = 86_400;

  /**
   * App session token issuer claim.
   */
  @NotEmpty
  private String sessionIssuer = "mytrainpro";

  /**
   * Cookie name the web app reads the session token from.
   */
  @NotEmpty
  private String sessionCookieName = "mtp_session";

  /**
   * Shared secret for server-side callers of {@code POST /auth/pending/create}, sent in the
   * {@code X-Handoff-Internal-Key} header. Empty disables that endpoint.
   */
  private String internalApiKey = "";

  @JsonProperty
  public long getPendingTtlSeconds() {
    return pendingTtlSeconds;
  }

  @JsonProperty
  public void setPendingTtlSeconds(long pendingTtlSeconds) {
    this.pendingTtlSeconds = pendingTtlSeconds;
  }

  @JsonProperty
  public long getPendingRetentionSeconds() {
    return pendingRetentionSeconds;
  }

  @JsonProperty
  public void setPendingRetentionSeconds(long pendingRetentionSeconds) {
    this.pendingRetentionSeconds = pendingRetentionSeconds;
  }

  @JsonProperty
  public int getMaxPendingSessions() {
    return maxPendingSessions;
  }

  @JsonProperty
  public void setMaxPendingSessions(int maxPendingSessions) {
    this.maxPendingSessions = maxPendingSessions;
  }

  @JsonProperty
  public String getDeepLinkScheme() {
    return deepLinkScheme;
  }

  @JsonProperty
  public void setDeepLinkScheme(String deepLinkScheme) {
    this.deepLinkScheme = deepLinkScheme;
  }

  @JsonProperty
  public String getSessionSecretHex() {
    return sessionSecretHex;
  }

  @JsonProperty
  public void setSessionSecretHex(String sessionSecretHex) {
    this.sessionSecretHex = sessionSecretHex;
  }

  @JsonProperty
  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  @JsonProperty
  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  @JsonProperty
  public String getSessionIssuer() {
    return sessionIssuer;
  }

  @JsonProperty
  public void setSessionIssuer(String sessionIssuer) {
    this.sessionIssuer = sessionIssuer;
  }

  @JsonProperty
  public String getSessionCookieName() {
    return sessionCookieName;
  }

  @JsonProperty
  public void setSessionCookieName(String sessionCookieName) {
    this.sessionCookieName = sessionCookieName;
  }

  @JsonProperty
  public String getInternalApiKey() {
    return internalApiKey;
  }

  @JsonProperty
  public void setInternalApiKey(String internalApiKey) {
    this.internalApiKey = internalApiKey;
  }
}
