package com.mytrainpro.handoff.client.deeplink;

import static com.mytrainpro.handoff.model.DeepLinks.CALLBACK_HOST;
import static com.mytrainpro.handoff.model.DeepLinks.CALLBACK_PATH;
import static com.mytrainpro.handoff.model.DeepLinks.SESSION_PARAM;
import static com.mytrainpro.handoff.model.DeepLinks.USER_ID_PARAM;

import com.mytrainpro.handoff.client.config.ReconciliationConfig;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses auth callback URLs such as {@code mytrainpro://auth/callback?session=H&userId=U}.
 * <p>
 * Pure: no state, no deduplication. Repeated delivery of one link yields the same request every
 * time; filtering duplicates is the idempotency guard's job.
 */
@Singleton
public class DeepLinkReceiver {

  private static final Logger log = LoggerFactory.getLogger(DeepLinkReceiver.class);

  private final String scheme;

  @Inject
  public DeepLinkReceiver(final ReconciliationConfig config) {
    this.scheme = config.deepLinkScheme();
  }

  /**
   * Extracts the handoff request from a launch URL.
   *
   * @param url the URL the app was opened with; may be null
   * @return the request, or empty if the URL is not a well-formed auth callback
   */
  public Optional<SessionHandoffRequest> parse(final String url) {
    if (url == null || url.isBlank()) {
      return Optional.empty();
    }
    final URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException e) {
      log.debug("Ignoring unparseable launch URL: {}", e.getMessage());
      return Optional.empty();
    }
    if (!scheme.equalsIgnoreCase(uri.getScheme())
        || !CALLBACK_HOST.equalsIgnoreCase(uri.getHost())
        || !CALLBACK_PATH.equals(uri.getPath())) {
      log.debug("Ignoring launch URL that is not an auth callback");
      return Optional.empty();
    }
    final Map<String, String> params;
    try {
      params = queryParameters(uri.getRawQuery());
    } catch (IllegalArgumentException e) {
      log.warn("Auth callback with malformed query: {}", e.getMessage());
      return Optional.empty();
    }
    final String session = params.get(SESSION_PARAM);
    if (session == null || session.isBlank()) {
      log.warn("Auth callback without a session parameter");
      return Optional.empty();
    }
    final String userId = params.get(USER_ID_PARAM);
    return Optional.of(new SessionHandoffRequest(session, userId == null || userId.isBlank() ? null : userId,
        HandoffTrigger.DEEP_LINK));
  }

  // First occurrence of a parameter wins.
  private static Map<String, String> queryParameters(final String rawQuery) {
    final Map<String, String> params = new HashMap<>();
    if (rawQuery == null || rawQuery.isEmpty()) {
      return params;
    }
    for (String pair : rawQuery.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      final int eq = pair.indexOf('=');
      final String name = decode(eq < 0 ? pair : pair.substring(0, eq));
      final String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
      params.putIfAbsent(name, value);
    }
    return params;
  }

  private static String decode(final String value) {
    return URLDecoder.decode(value, StandardCharsets.UTF_8);
  }
}
