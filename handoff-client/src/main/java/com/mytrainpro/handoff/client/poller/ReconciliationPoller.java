package com.mytrainpro.handoff.client.poller;

import com.mytrainpro.handoff.client.accessor.HandoffAccessor;
import com.mytrainpro.handoff.client.config.ReconciliationConfig;
import com.mytrainpro.handoff.client.deeplink.HandoffTrigger;
import com.mytrainpro.handoff.client.deeplink.SessionHandoffRequest;
import com.mytrainpro.handoff.client.exceptions.HandoffAccessorException;
import com.mytrainpro.handoff.model.LogMasks;
import com.mytrainpro.handoff.model.pending.PendingLookupResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the server for a pending session when the app comes to the foreground, covering the case
 * where the deep link never arrived.
 * <p>
 * A sequence makes at most {@code maxAttempts} lookups, {@code retryDelay} apart, and ends at
 * the first hit. Failed lookups count as misses. Running out of attempts is not an error.
 * <p>
 * Only one sequence is active at a time. Every {@link #start} and {@link #stop} bumps a
 * generation counter; a sequence that sees a newer generation stops before its next lookup and
 * never reports a hit.
 */
@Singleton
public class ReconciliationPoller {

  private static final Logger log = LoggerFactory.getLogger(ReconciliationPoller.class);

  private final HandoffAccessor accessor;
  private final Executor executor;
  private final Sleeper sleeper;
  private final int maxAttempts;
  private final Duration retryDelay;
  private final AtomicLong generation = new AtomicLong();

  @Inject
  public ReconciliationPoller(final ReconciliationConfig config,
                              final HandoffAccessor accessor,
                              final Executor executor,
                              final Sleeper sleeper) {
    log.info("ReconciliationPoller(maxAttempts={}, retryDelay={})", config.maxAttempts(), config.retryDelay());
    this.accessor = accessor;
    this.executor = executor;
    this.sleeper = sleeper;
    this.maxAttempts = config.maxAttempts();
    this.retryDelay = config.retryDelay();
  }

  /**
   * Starts a new sequence, abandoning any running one.
   *
   * @param deviceId device to look up
   * @param onFound  receives the first handle found; called on the executor's thread
   */
  public void start(final String deviceId, final Consumer<SessionHandoffRequest> onFound) {
    final long current = generation.incrementAndGet();
    log.debug("Starting reconciliation sequence {}", current);
    executor.execute(() -> run(current, deviceId, onFound));
  }

  /**
   * Abandons the running sequence, if any. The in-flight lookup, if any, completes but its result
   * is dropped.
   */
  public void stop() {
    generation.incrementAndGet();
  }

  private void run(final long sequence, final String deviceId, final Consumer<SessionHandoffRequest> onFound) {
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      if (isStale(sequence)) {
        log.debug("Reconciliation sequence {} superseded before attempt {}", sequence, attempt);
        return;
      }
      final Optional<SessionHandoffRequest> found = lookupOnce(deviceId, attempt);
      if (found.isPresent()) {
        if (isStale(sequence)) {
          log.debug("Reconciliation sequence {} superseded; dropping hit", sequence);
          return;
        }
        log.debug("Reconciliation found handle={} on attempt {}",
            LogMasks.mask(found.get().sessionHandle()), attempt);
        onFound.accept(found.get());
        return;
      }
      if (attempt < maxAttempts) {
        try {
          sleeper.sleep(retryDelay);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          log.debug("Reconciliation sequence {} interrupted", sequence);
          return;
        }
      }
    }
    log.debug("Reconciliation sequence {} found nothing after {} attempts", sequence, maxAttempts);
  }

  private Optional<SessionHandoffRequest> lookupOnce(final String deviceId, final int attempt) {
    try {
      final PendingLookupResponse response = accessor.lookup(deviceId);
      if (response.found() && response.sessionHandle() != null && !response.sessionHandle().isBlank()) {
        return Optional.of(new SessionHandoffRequest(response.sessionHandle(), response.userId(),
            HandoffTrigger.RECONCILIATION));
      }
    } catch (HandoffAccessorException e) {
      log.debug("Lookup attempt {} failed: {}", attempt, e.getMessage());
    }
    return Optional.empty();
  }

  private boolean isStale(final long sequence) {
    return generation.get() != sequence;
  }
}
