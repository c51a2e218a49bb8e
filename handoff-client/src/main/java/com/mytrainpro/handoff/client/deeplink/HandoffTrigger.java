package com.mytrainpro.handoff.client.deeplink;

/**
 * Which path surfaced a session handle.
 */
public enum HandoffTrigger {
  /**
   * The browser opened the app through its callback URL.
   */
  DEEP_LINK,
  /**
   * The app asked the server on foreground.
   */
  RECONCILIATION
}
