package com.mytrainpro.handoff.springboot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "handoff")
public class HandoffProperties {

  private long pendingTtlSeconds = 300;
  private long pendingRetentionSeconds = 600;
  private int maxPendingSessions = 10_000;
  private String deepLinkScheme = "mytrainpro";
  private String sessionSecretHex = "";
  private long sessionTtlSeconds = 86_400;
  private String sessionIssuer = "mytrainpro";
  private String sessionCookieName = "mtp_session";
  private String internalApiKey = "";

  public long getPendingTtlSeconds() {
    return pendingTtlSeconds;
  }

  public void setPendingTtlSeconds(long pendingTtlSeconds) {
    this.pendingTtlSeconds = pendingTtlSeconds;
  }

  public long getPendingRetentionSeconds() {
    return pendingRetentionSeconds;
  }

  public void setPendingRetentionSeconds(long pendingRetentionSeconds) {
    this.pendingRetentionSeconds = pendingRetentionSeconds;
  }

  public int getMaxPendingSessions() {
    return maxPendingSessions;
  }

  public void setMaxPendingSessions(int maxPendingSessions) {
    this.maxPendingSessions = maxPendingSessions;
  }

  public String getDeepLinkScheme() {
    return deepLinkScheme;
  }

  public void setDeepLinkScheme(String deepLinkScheme) {
    this.deepLinkScheme = deepLinkScheme;
  }

  public String getSessionSecretHex() {
    return sessionSecretHex;
  }

  public void setSessionSecretHex(String sessionSecretHex) {
    this.sessionSecretHex = sessionSecretHex;
  }

  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  public String getSessionIssuer() {
    return sessionIssuer;
  }

  public void setSessionIssuer(String sessionIssuer) {
    this.sessionIssuer = sessionIssuer;
  }

  public String getSessionCookieName() {
    return sessionCookieName;
  }

  public void setSessionCookieName(String sessionCookieName) {
    this.sessionCookieName = sessionCookieName;
  }

  public String getInternalApiKey() {
    return internalApiKey;
  }

  public void setInternalApiKey(String internalApiKey) {
    this.internalApiKey = internalApiKey;
  }
}
