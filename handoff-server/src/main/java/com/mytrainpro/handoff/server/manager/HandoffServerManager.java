package com.mytrainpro.handoff.server.manager;

import com.mytrainpro.handoff.model.LogMasks;
import com.mytrainpro.handoff.model.callback.CallbackCompleteRequest;
import com.mytrainpro.handoff.model.callback.CallbackCompleteResponse;
import com.mytrainpro.handoff.model.pending.PendingConsumeRequest;
import com.mytrainpro.handoff.model.pending.PendingConsumeResponse;
import com.mytrainpro.handoff.model.pending.PendingCreateRequest;
import com.mytrainpro.handoff.model.pending.PendingCreateResponse;
import com.mytrainpro.handoff.model.pending.PendingLookupRequest;
import com.mytrainpro.handoff.model.pending.PendingLookupResponse;
import com.mytrainpro.handoff.server.identity.IdentityVerifier;
import com.mytrainpro.handoff.server.store.PendingSession;
import com.mytrainpro.handoff.server.store.PendingSessionStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service implementing the server side of the pending-session handoff.
 * <p>
 * Framework adapters ({@code PendingSessionResource} for JAX-RS / Dropwizard,
 * {@code HandoffController} for Spring Boot) stay thin wrappers that only translate exceptions
 * into framework-specific HTTP error responses.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException} - missing or blank request fields, HTTP 400</li>
 *   <li>{@link SecurityException}        - identity token rejected, HTTP 401</li>
 *   <li>{@link IllegalStateException}    - pending store at capacity, HTTP 503</li>
 * </ul>
 * Consume outcomes other than success are not exceptions; they travel in the response body.
 */
public class HandoffServerManager {

  private static final Logger log = LoggerFactory.getLogger(HandoffServerManager.class);

  private final PendingSessionStore pendingSessionStore;
  private final SessionMaterializer sessionMaterializer;
  private final IdentityVerifier identityVerifier;
  private final DeepLinkBuilder deepLinkBuilder;
  private final Duration retention;
  private final Clock clock;

  private final ScheduledExecutorService pendingReaper =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "pending-session-reaper");
        t.setDaemon(true);
        return t;
      });

  /**
   * Creates the manager and starts the reaper.
   *
   * @param pendingSessionStore the pending store
   * @param sessionMaterializer turns consumed records into app sessions
   * @param identityVerifier    verifies identity-provider tokens at callback completion
   * @param deepLinkBuilder     builds the app deep link
   * @param retention           how long records are kept past {@code expiresAt}
   * @param clock               time source for the reaper cutoff
   */
  public HandoffServerManager(PendingSessionStore pendingSessionStore,
                              SessionMaterializer sessionMaterializer,
                              IdentityVerifier identityVerifier,
                              DeepLinkBuilder deepLinkBuilder,
                              Duration retention,
                              Clock clock) {
    this.pendingSessionStore = pendingSessionStore;
    this.sessionMaterializer = sessionMaterializer;
    this.identityVerifier = identityVerifier;
    this.deepLinkBuilder = deepLinkBuilder;
    this.retention = retention;
    this.clock = clock;
    long periodSeconds = Math.max(1, retention.toSeconds() / 4);
    pendingReaper.scheduleAtFixedRate(this::reapSafely, periodSeconds, periodSeconds, TimeUnit.SECONDS);
    log.info("HandoffServerManager started (retention={})", retention);
  }

  /**
   * Shuts down the reaper thread pool.
   * <p>
   * In Dropwizard, register this instance as a {@code Managed} component.
   * In Spring Boot, declare the bean with {@code @Bean(destroyMethod = "shutdown")}.
   */
  public void shutdown() {
    pendingReaper.shutdown();
  }

  // ── Pending sessions ─────────────────────────────────────────────────────

  /**
   * Creates a pending session for an already verified user.
   *
   * @throws IllegalArgumentException if deviceId or userId is missing
   * @throws IllegalStateException    if the store has reached capacity
   */
  public PendingCreateResponse create(PendingCreateRequest req) {
    log.debug("create()");
    requireField(req == null ? null : req.deviceId(), "deviceId");
    requireField(req.userId(), "userId");
    PendingSession session = pendingSessionStore.create(req.deviceId(), req.userId());
    return new PendingCreateResponse(session.sessionHandle(), session.expiresAt());
  }

  /**
   * Looks up the device's live pending session. "Nothing pending" is a normal answer.
   *
   * @throws IllegalArgumentException if deviceId is missing
   */
  public PendingLookupResponse lookup(PendingLookupRequest req) {
    log.debug("lookup()");
    requireField(req == null ? null : req.deviceId(), "deviceId");
    return pendingSessionStore.lookup(req.deviceId())
        .map(s -> PendingLookupResponse.found(s.sessionHandle(), s.userId()))
        .orElseGet(PendingLookupResponse::notFound);
  }

  /**
   * Consumes a pending session and, for the single winning caller, issues the app session.
   *
   * @throws IllegalArgumentException if sessionHandle is missing
   */
  public PendingConsumeResponse consume(PendingConsumeRequest req) {
    requireField(req == null ? null : req.sessionHandle(), "sessionHandle");
    log.debug("consume(sessionHandle={})", LogMasks.mask(req.sessionHandle()));
    return sessionMaterializer.materialize(req.sessionHandle());
  }

  // ── OAuth callback ───────────────────────────────────────────────────────

  /**
   * Completes the browser-side OAuth callback: verifies the identity token, creates the pending
   * session and returns the deep link the browser should open.
   *
   * @throws IllegalArgumentException if a field is missing
   * @throws SecurityException        if the identity token is rejected
   * @throws IllegalStateException    if the store has reached capacity
   */
  public CallbackCompleteResponse completeCallback(CallbackCompleteRequest req) {
    log.debug("completeCallback()");
    requireField(req == null ? null : req.deviceId(), "deviceId");
    if (req.provider() == null) {
      throw new IllegalArgumentException("Missing required field: provider");
    }
    requireField(req.idToken(), "idToken");
    String userId = identityVerifier.verify(req.provider(), req.idToken())
        .orElseThrow(() -> new SecurityException("Identity verification failed"));
    PendingSession session = pendingSessionStore.create(req.deviceId(), userId);
    String deepLink = deepLinkBuilder.build(session.sessionHandle(), userId);
    log.info("Callback complete for provider={}, handle={}", req.provider().wireValue(),
        LogMasks.mask(session.sessionHandle()));
    return new CallbackCompleteResponse(session.sessionHandle(), session.expiresAt(), deepLink);
  }

  // ── Garbage collection ───────────────────────────────────────────────────

  /**
   * Removes records whose {@code expiresAt} passed more than the retention window ago. Runs on
   * the reaper thread; exposed for tests and for operators triggering it by hand.
   *
   * @return number of records removed
   */
  public int reap() {
    Instant cutoff = clock.instant().minus(retention);
    return pendingSessionStore.purgeExpired(cutoff);
  }

  private void reapSafely() {
    try {
      reap();
    } catch (RuntimeException e) {
      // an exception escaping would cancel the scheduled task
      log.error("Pending session reaper failed", e);
    }
  }

  private static void requireField(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + name);
    }
  }
}
