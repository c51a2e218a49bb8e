package com.mytrainpro.handoff.springboot.config;

import com.mytrainpro.handoff.server.auth.AppSessionManager;
import com.mytrainpro.handoff.server.auth.InternalApiKey;
import com.mytrainpro.handoff.server.identity.IdentityVerifier;
import com.mytrainpro.handoff.server.manager.DeepLinkBuilder;
import com.mytrainpro.handoff.server.manager.HandoffServerManager;
import com.mytrainpro.handoff.server.manager.SessionMaterializer;
import com.mytrainpro.handoff.server.store.InMemoryPendingSessionStore;
import com.mytrainpro.handoff.server.store.InMemorySessionStore;
import com.mytrainpro.handoff.server.store.PendingSessionStore;
import com.mytrainpro.handoff.server.store.SessionStore;
import com.mytrainpro.handoff.springboot.controller.HandoffController;
import com.mytrainpro.handoff.springboot.controller.SessionController;
import com.mytrainpro.handoff.springboot.health.PendingSessionStoreHealthIndicator;
import com.mytrainpro.handoff.springboot.security.HandoffSecurityConfig;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

@AutoConfiguration(before = SecurityAutoConfiguration.class)
@EnableConfigurationProperties(HandoffProperties.class)
@Import({HandoffController.class, SessionController.class, HandoffSecurityConfig.class})
public class HandoffAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(HandoffAutoConfiguration.class);

  /**
   * Default {@link SecureRandom} instance, used for session handles and the dev-mode secret.
   * Override this bean to supply a custom implementation.
   */
  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Verifier that rejects everything. Applications must provide their own
   * {@link IdentityVerifier} bean for the OAuth callback endpoint to accept logins.
   */
  @Bean
  @ConditionalOnMissingBean
  public IdentityVerifier identityVerifier() {
    log.warn("No IdentityVerifier bean found. The OAuth callback endpoint will reject every token.");
    return IdentityVerifier.rejectingAll();
  }

  @Bean
  @ConditionalOnMissingBean
  public PendingSessionStore pendingSessionStore(HandoffProperties props, Clock clock,
                                                 SecureRandom secureRandom) {
    log.warn("Using in-memory pending session store. All data will be lost on restart. Do not use in production.");
    return new InMemoryPendingSessionStore(clock, Duration.ofSeconds(props.getPendingTtlSeconds()),
        props.getMaxPendingSessions(), secureRandom);
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionStore sessionStore() {
    log.warn("Using in-memory session store. All data will be lost on restart. Do not use in production.");
    return new InMemorySessionStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public AppSessionManager appSessionManager(HandoffProperties props, SessionStore sessionStore,
                                             SecureRandom secureRandom) {
    String secretHex = props.getSessionSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No session secret configured; generating randomly. "
          + "Sessions will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      secureRandom.nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new AppSessionManager(secret, props.getSessionIssuer(),
        Duration.ofSeconds(props.getSessionTtlSeconds()), props.getSessionCookieName(), sessionStore);
  }

  /**
   * Key that server-side callers present to {@code POST /auth/pending/create}. Blank disables
   * the endpoint.
   */
  @Bean
  @ConditionalOnMissingBean
  public InternalApiKey internalApiKey(HandoffProperties props) {
    return new InternalApiKey(props.getInternalApiKey());
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public HandoffServerManager handoffServerManager(HandoffProperties props,
                                                   PendingSessionStore pendingSessionStore,
                                                   AppSessionManager appSessionManager,
                                                   IdentityVerifier identityVerifier,
                                                   Clock clock) {
    return new HandoffServerManager(
        pendingSessionStore,
        new SessionMaterializer(pendingSessionStore, appSessionManager),
        identityVerifier,
        new DeepLinkBuilder(props.getDeepLinkScheme()),
        Duration.ofSeconds(props.getPendingRetentionSeconds()),
        clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public PendingSessionStoreHealthIndicator pendingSessionStoreHealthIndicator(
      PendingSessionStore pendingSessionStore, HandoffProperties props) {
    return new PendingSessionStoreHealthIndicator(pendingSessionStore, props);
  }
}
