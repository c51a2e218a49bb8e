package com.mytrainpro.handoff.model;

/**
 * Shape of the application-scheme URL the browser redirects to once a pending session exists.
 * <p>
 * Example: {@code mytrainpro://auth/callback?session=<sessionHandle>&userId=<userId>}.
 * The server builds these links and the client parses them, so both sides read the host, path
 * and parameter names from here.
 */
public final class DeepLinks {

  /**
   * Scheme registered by the installed app unless configured otherwise.
   */
  public static final String DEFAULT_SCHEME = "mytrainpro";

  /**
   * Host component of an auth callback link.
   */
  public static final String CALLBACK_HOST = "auth";

  /**
   * Path component of an auth callback link.
   */
  public static final String CALLBACK_PATH = "/callback";

  /**
   * Query parameter carrying the pending session handle.
   */
  public static final String SESSION_PARAM = "session";

  /**
   * Query parameter carrying the user id. Diagnostic only; the server is the source of truth.
   */
  public static final String USER_ID_PARAM = "userId";

  private DeepLinks() {
  }
}
