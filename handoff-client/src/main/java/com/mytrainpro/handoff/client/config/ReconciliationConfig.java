package com.mytrainpro.handoff.client.config;

import com.mytrainpro.handoff.model.DeepLinks;
import java.time.Duration;

/**
 * Client-side tuning for the handoff.
 *
 * @param maxAttempts     lookups per reconciliation sequence
 * @param retryDelay      pause between lookups, and between consume retries
 * @param requestTimeout  per-request HTTP timeout
 * @param consumeAttempts attempts for one consume call before giving up on transient failures
 * @param deepLinkScheme  scheme the app registered for auth callbacks
 */
public record ReconciliationConfig(int maxAttempts,
                                   Duration retryDelay,
                                   Duration requestTimeout,
                                   int consumeAttempts,
                                   String deepLinkScheme) {

  public ReconciliationConfig {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    if (consumeAttempts < 1) {
      throw new IllegalArgumentException("consumeAttempts must be at least 1");
    }
    if (retryDelay == null || retryDelay.isNegative()) {
      throw new IllegalArgumentException("retryDelay must be zero or positive");
    }
    if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
    if (deepLinkScheme == null || deepLinkScheme.isBlank()) {
      throw new IllegalArgumentException("deepLinkScheme is required");
    }
  }

  /**
   * Six lookups two seconds apart, a ten second request timeout and three consume attempts.
   *
   * @return the default config
   */
  public static ReconciliationConfig defaults() {
    return new ReconciliationConfig(6, Duration.ofSeconds(2), Duration.ofSeconds(10), 3,
        DeepLinks.DEFAULT_SCHEME);
  }
}
