package com.mytrainpro.handoff.springboot.health;

import com.mytrainpro.handoff.server.store.PendingSessionStore;
import com.mytrainpro.handoff.springboot.config.HandoffProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports DOWN once the pending store is full, since every new login then fails with 503.
 */
public class PendingSessionStoreHealthIndicator implements HealthIndicator {

  private final PendingSessionStore store;
  private final int maxPendingSessions;

  public PendingSessionStoreHealthIndicator(PendingSessionStore store, HandoffProperties props) {
    this.store = store;
    this.maxPendingSessions = props.getMaxPendingSessions();
  }

  @Override
  public Health health() {
    int size = store.size();
    if (size >= maxPendingSessions) {
      return Health.down()
          .withDetail("reason", "Pending session store full")
          .withDetail("pendingSessions", size)
          .withDetail("maxPendingSessions", maxPendingSessions)
          .build();
    }
    return Health.up()
        .withDetail("pendingSessions", size)
        .withDetail("maxPendingSessions", maxPendingSessions)
        .build();
  }
}
