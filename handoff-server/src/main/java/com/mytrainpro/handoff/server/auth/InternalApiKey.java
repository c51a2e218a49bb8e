package com.mytrainpro.handoff.server.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared secret that server-side callers present to reach {@code POST /auth/pending/create}.
 * <p>
 * Creating a pending session hands out an app session for any user id, so the endpoint is only
 * for trusted server code that has already verified the identity itself. Browsers and apps go
 * through {@code /auth/callback/complete}. With no key configured the endpoint rejects every
 * request.
 */
public class InternalApiKey {

  /**
   * Request header carrying the key.
   */
  public static final String HEADER = "X-Handoff-Internal-Key";

  private static final Logger log = LoggerFactory.getLogger(InternalApiKey.class);

  private final byte[] expected;

  /**
   * @param configured the configured key; null or blank disables the internal create endpoint
   */
  public InternalApiKey(String configured) {
    if (configured == null || configured.isBlank()) {
      log.info("No internal API key configured; POST /auth/pending/create is disabled");
      this.expected = null;
    } else {
      this.expected = configured.getBytes(StandardCharsets.UTF_8);
    }
  }

  public boolean enabled() {
    return expected != null;
  }

  /**
   * Constant-time comparison against the configured key.
   *
   * @param presented the header value, may be null
   * @return true only when a key is configured and the presented value equals it
   */
  public boolean matches(String presented) {
    if (expected == null || presented == null) {
      return false;
    }
    return MessageDigest.isEqual(expected, presented.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * @param presented the header value, may be null
   * @throws SecurityException if the presented value does not match
   */
  public void require(String presented) {
    if (!matches(presented)) {
      log.warn("Rejected internal call without a valid {} header", HEADER);
      throw new SecurityException("Internal API key required");
    }
  }
}
