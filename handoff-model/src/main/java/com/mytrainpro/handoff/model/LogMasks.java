package com.mytrainpro.handoff.model;

/**
 * Shortens bearer-like values before they reach a log line.
 */
public final class LogMasks {

  private static final int VISIBLE_PREFIX = 6;

  private LogMasks() {
  }

  /**
   * Returns the first few characters of the value followed by an ellipsis.
   *
   * @param value a session handle, session id or token; may be null
   * @return the masked value
   */
  public static String mask(String value) {
    if (value == null) {
      return "null";
    }
    if (value.length() <= VISIBLE_PREFIX) {
      return "***";
    }
    return value.substring(0, VISIBLE_PREFIX) + "...";
  }
}
