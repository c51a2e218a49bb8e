package com.mytrainpro.handoff.server.manager;

import static com.mytrainpro.handoff.model.DeepLinks.CALLBACK_HOST;
import static com.mytrainpro.handoff.model.DeepLinks.CALLBACK_PATH;
import static com.mytrainpro.handoff.model.DeepLinks.SESSION_PARAM;
import static com.mytrainpro.handoff.model.DeepLinks.USER_ID_PARAM;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds the application-scheme URL the browser opens to hand control back to the app.
 */
public class DeepLinkBuilder {

  private final String scheme;

  /**
   * Instantiates a new deep link builder.
   *
   * @param scheme the scheme the app registered, e.g. {@code mytrainpro}
   */
  public DeepLinkBuilder(String scheme) {
    if (scheme == null || scheme.isBlank()) {
      throw new IllegalArgumentException("Deep link scheme is required");
    }
    this.scheme = scheme;
  }

  /**
   * Builds {@code <scheme>://auth/callback?session=<handle>&userId=<userId>}.
   *
   * @param sessionHandle the pending session handle
   * @param userId        the user id, carried for diagnostics only
   * @return the deep link
   */
  public String build(String sessionHandle, String userId) {
    return scheme + "://" + CALLBACK_HOST + CALLBACK_PATH
        + "?" + SESSION_PARAM + "=" + encode(sessionHandle)
        + "&" + USER_ID_PARAM + "=" + encode(userId);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
