package com.mytrainpro.handoff.client.manager;

import com.mytrainpro.handoff.client.accessor.HandoffAccessor;
import com.mytrainpro.handoff.client.config.ReconciliationConfig;
import com.mytrainpro.handoff.client.deeplink.DeepLinkReceiver;
import com.mytrainpro.handoff.client.deeplink.SessionHandoffRequest;
import com.mytrainpro.handoff.client.exceptions.HandoffAccessorException;
import com.mytrainpro.handoff.client.guard.IdempotencyGuard;
import com.mytrainpro.handoff.client.poller.ReconciliationPoller;
import com.mytrainpro.handoff.client.poller.Sleeper;
import com.mytrainpro.handoff.client.storage.DeviceIdProvider;
import com.mytrainpro.handoff.model.LogMasks;
import com.mytrainpro.handoff.model.pending.PendingConsumeResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * App-side coordinator of the session handoff.
 * <p>
 * Two paths surface a session handle: the deep link the browser opens ({@link #onLaunchUrl}) and
 * the reconciliation poller started on foreground ({@link #onForeground}). Both funnel into one
 * processing step guarded by {@link IdempotencyGuard#tryBegin}, so a handle is consumed at most
 * once per device and a duplicate trigger produces no events at all.
 * <p>
 * Processing blocks on network calls. {@link #onLaunchUrl} runs it on the calling thread, which
 * must not be the UI thread; the poller path runs it on the poller's executor.
 */
@Singleton
public class HandoffManager {

  private static final Logger log = LoggerFactory.getLogger(HandoffManager.class);

  private final HandoffAccessor accessor;
  private final DeepLinkReceiver deepLinkReceiver;
  private final IdempotencyGuard guard;
  private final ReconciliationPoller poller;
  private final DeviceIdProvider deviceIdProvider;
  private final SessionRestorer sessionRestorer;
  private final Sleeper sleeper;
  private final int consumeAttempts;
  private final Duration retryDelay;
  private final List<HandoffListener> listeners = new CopyOnWriteArrayList<>();

  @Inject
  public HandoffManager(final ReconciliationConfig config,
                        final HandoffAccessor accessor,
                        final DeepLinkReceiver deepLinkReceiver,
                        final IdempotencyGuard guard,
                        final ReconciliationPoller poller,
                        final DeviceIdProvider deviceIdProvider,
                        final SessionRestorer sessionRestorer,
                        final Sleeper sleeper) {
    log.info("HandoffManager({})", config);
    this.accessor = accessor;
    this.deepLinkReceiver = deepLinkReceiver;
    this.guard = guard;
    this.poller = poller;
    this.deviceIdProvider = deviceIdProvider;
    this.sessionRestorer = sessionRestorer;
    this.sleeper = sleeper;
    this.consumeAttempts = config.consumeAttempts();
    this.retryDelay = config.retryDelay();
  }

  public void addListener(final HandoffListener listener) {
    listeners.add(listener);
  }

  public void removeListener(final HandoffListener listener) {
    listeners.remove(listener);
  }

  // ── Triggers ─────────────────────────────────────────────────────────────

  /**
   * Handles the URL the app was opened or resumed with.
   *
   * @param url launch URL; anything other than an auth callback is ignored
   * @return true if the URL was an auth callback
   */
  public boolean onLaunchUrl(final String url) {
    final Optional<SessionHandoffRequest> request = deepLinkReceiver.parse(url);
    request.ifPresent(this::process);
    return request.isPresent();
  }

  /**
   * Starts a reconciliation sequence. Call on launch, resume and whenever the app becomes visible.
   */
  public void onForeground() {
    poller.start(deviceIdProvider.deviceId(), this::process);
  }

  /**
   * Abandons any running reconciliation sequence.
   */
  public void onBackground() {
    poller.stop();
  }

  /**
   * Explicit logout: stops reconciliation and forgets the processed-handle marker.
   */
  public void logout() {
    poller.stop();
    guard.clear();
  }

  // ── Processing ───────────────────────────────────────────────────────────

  void process(final SessionHandoffRequest request) {
    final String handle = request.sessionHandle();
    if (!guard.tryBegin(handle)) {
      return;
    }
    log.debug("Processing handle={} from {}", LogMasks.mask(handle), request.trigger());
    emit(new HandoffEvent(HandoffState.HANDOFF_PENDING, handle, request.trigger(), null));
    poller.stop();

    final Optional<ConsumeOutcome> outcome = consumeWithRetry(handle);
    if (outcome.isEmpty()) {
      emit(new HandoffEvent(HandoffState.HANDOFF_ERROR, handle, request.trigger(), null));
      return;
    }
    final PendingConsumeResponse response = outcome.get().response();
    switch (response.status()) {
      case OK -> complete(request, response);
      case ALREADY_CONSUMED -> {
        if (outcome.get().lostEarlierAttempt()) {
          // the lost attempt may have been the one that consumed it; its session is gone
          log.warn("Handle={} already consumed after a failed attempt; sign-in required",
              LogMasks.mask(handle));
          emit(new HandoffEvent(HandoffState.HANDOFF_ERROR, handle, request.trigger(), null));
        } else {
          log.debug("Handle={} was consumed by the other path", LogMasks.mask(handle));
          emit(new HandoffEvent(HandoffState.HANDOFF_NOOP, handle, request.trigger(), null));
        }
      }
      case EXPIRED -> {
        log.info("Handle={} expired; sign-in required", LogMasks.mask(handle));
        emit(new HandoffEvent(HandoffState.HANDOFF_EXPIRED, handle, request.trigger(), null));
      }
      default -> {
        log.warn("Server does not know handle={} from {}", LogMasks.mask(handle), request.trigger());
        emit(new HandoffEvent(HandoffState.HANDOFF_ERROR, handle, request.trigger(), null));
      }
    }
  }

  private void complete(final SessionHandoffRequest request, final PendingConsumeResponse response) {
    final String handle = request.sessionHandle();
    if (response.appSession() == null) {
      log.warn("Consume of handle={} returned ok without a session", LogMasks.mask(handle));
      emit(new HandoffEvent(HandoffState.HANDOFF_ERROR, handle, request.trigger(), null));
      return;
    }
    try {
      sessionRestorer.restore(response.appSession());
    } catch (RuntimeException e) {
      log.error("Restoring session for handle={} failed", LogMasks.mask(handle), e);
      emit(new HandoffEvent(HandoffState.HANDOFF_ERROR, handle, request.trigger(), null));
      return;
    }
    log.info("Handoff complete via {}", request.trigger());
    emit(new HandoffEvent(HandoffState.HANDOFF_COMPLETE, handle, request.trigger(), response.appSession()));
  }

  /**
   * A consume answer, and whether an earlier attempt in the same run failed in transit. Such an
   * attempt may have reached the server, so a later {@code already_consumed} can be our own.
   */
  private record ConsumeOutcome(PendingConsumeResponse response, boolean lostEarlierAttempt) {
  }

  private Optional<ConsumeOutcome> consumeWithRetry(final String handle) {
    for (int attempt = 1; attempt <= consumeAttempts; attempt++) {
      try {
        return Optional.of(new ConsumeOutcome(accessor.consume(handle), attempt > 1));
      } catch (HandoffAccessorException e) {
        log.warn("Consume attempt {}/{} for handle={} failed: {}", attempt, consumeAttempts,
            LogMasks.mask(handle), e.getMessage());
      }
      if (attempt < consumeAttempts) {
        try {
          sleeper.sleep(retryDelay);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return Optional.empty();
        }
      }
    }
    return Optional.empty();
  }

  private void emit(final HandoffEvent event) {
    for (HandoffListener listener : listeners) {
      try {
        listener.onHandoffEvent(event);
      } catch (RuntimeException e) {
        log.warn("Handoff listener failed on {}", event.state(), e);
      }
    }
  }
}
