package com.mytrainpro.handoff.dropwizard;

import com.mytrainpro.handoff.dropwizard.auth.HandoffAuthenticator;
import com.mytrainpro.handoff.dropwizard.auth.HandoffPrincipal;
import com.mytrainpro.handoff.dropwizard.health.PendingSessionStoreHealthCheck;
import com.mytrainpro.handoff.dropwizard.resource.SessionResource;
import com.mytrainpro.handoff.server.auth.AppSessionManager;
import com.mytrainpro.handoff.server.auth.InternalApiKey;
import com.mytrainpro.handoff.server.identity.IdentityVerifier;
import com.mytrainpro.handoff.server.manager.DeepLinkBuilder;
import com.mytrainpro.handoff.server.manager.HandoffServerManager;
import com.mytrainpro.handoff.server.manager.SessionMaterializer;
import com.mytrainpro.handoff.server.resource.PendingSessionResource;
import com.mytrainpro.handoff.server.store.InMemoryPendingSessionStore;
import com.mytrainpro.handoff.server.store.InMemorySessionStore;
import com.mytrainpro.handoff.server.store.PendingSessionStore;
import com.mytrainpro.handoff.server.store.SessionStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.Managed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the pending-session handoff into an existing Dropwizard
 * application.
 * <p>
 * Registers the handoff JAX-RS resources, the session resource, a health check for the pending
 * store and a bearer-token authentication filter for app sessions, so applications can protect
 * their own resources with {@code @Auth HandoffPrincipal}. Requires a
 * {@link HandoffConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new HandoffBundle<>(myIdentityVerifier));
 * }</pre>
 * <p>
 * Or supply persistent stores:
 * <pre>{@code
 *   bootstrap.addBundle(new HandoffBundle<>(myPendingStore, mySessionStore, myIdentityVerifier));
 * }</pre>
 * Without an identity verifier the callback endpoint rejects every token.
 */
@Singleton
public class HandoffBundle<C extends HandoffConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(HandoffBundle.class);

  private final PendingSessionStore pendingSessionStore;
  private final SessionStore sessionStore;
  private final IdentityVerifier identityVerifier;

  /**
   * Creates a bundle backed by in-memory stores whose callback endpoint rejects every token.
   * Servers that verify identities themselves create pending sessions through
   * {@code POST /auth/pending/create}, authenticated with {@code internalApiKey}.
   */
  public HandoffBundle() {
    this(IdentityVerifier.rejectingAll());
  }

  /**
   * Creates a bundle backed by in-memory stores.
   * <p>
   * For dev/test only; all pending and app sessions are lost on restart.
   *
   * @param identityVerifier verifies identity-provider tokens at callback completion
   */
  public HandoffBundle(IdentityVerifier identityVerifier) {
    this.pendingSessionStore = null;
    this.sessionStore = new InMemorySessionStore();
    this.identityVerifier = identityVerifier;
    log.warn("""
        #################################################################
        # WARNING: Using ephemeral in-memory pending and session stores. #
        # All sessions will be lost on restart.                         #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores. The pending store's own TTL and capacity
   * apply; {@code pendingTtlSeconds} in the configuration is ignored.
   *
   * @param pendingSessionStore the pending store
   * @param sessionStore        the app session store
   * @param identityVerifier    verifies identity-provider tokens at callback completion
   */
  @Inject
  public HandoffBundle(PendingSessionStore pendingSessionStore,
                       SessionStore sessionStore,
                       IdentityVerifier identityVerifier) {
    this.pendingSessionStore = pendingSessionStore;
    this.sessionStore = sessionStore;
    this.identityVerifier = identityVerifier;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    PendingSessionStore pendingStore = pendingSessionStore != null
        ? pendingSessionStore
        : new InMemoryPendingSessionStore(Duration.ofSeconds(configuration.getPendingTtlSeconds()),
            configuration.getMaxPendingSessions());
    AppSessionManager appSessionManager = buildAppSessionManager(configuration);

    HandoffServerManager handoffServerManager = new HandoffServerManager(
        pendingStore,
        new SessionMaterializer(pendingStore, appSessionManager),
        identityVerifier,
        new DeepLinkBuilder(configuration.getDeepLinkScheme()),
        Duration.ofSeconds(configuration.getPendingRetentionSeconds()),
        Clock.systemUTC());
    environment.lifecycle().manage(new Managed() {
      @Override
      public void stop() {
        handoffServerManager.shutdown();
      }
    });

    environment.jersey().register(new PendingSessionResource(handoffServerManager,
        new InternalApiKey(configuration.getInternalApiKey())));
    environment.jersey().register(new SessionResource(appSessionManager));
    environment.healthChecks().register("pending-session-store",
        new PendingSessionStoreHealthCheck(pendingStore, configuration.getMaxPendingSessions()));

    // App session auth filter
    HandoffAuthenticator authenticator = new HandoffAuthenticator(appSessionManager);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<HandoffPrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(HandoffPrincipal.class));
  }

  private AppSessionManager buildAppSessionManager(C configuration) {
    String secretHex = configuration.getSessionSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No session secret configured; generating randomly. "
          + "Sessions will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new AppSessionManager(secret, configuration.getSessionIssuer(),
        Duration.ofSeconds(configuration.getSessionTtlSeconds()),
        configuration.getSessionCookieName(), sessionStore);
  }
}
