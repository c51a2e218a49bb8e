package com.mytrainpro.handoff.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.mytrainpro.handoff.server.store.PendingSessionStore;

/**
 * Reports the pending store unhealthy once it is full, since every new login then fails with 503.
 */
public class PendingSessionStoreHealthCheck extends HealthCheck {

  private final PendingSessionStore store;
  private final int maxPendingSessions;

  public PendingSessionStoreHealthCheck(PendingSessionStore store, int maxPendingSessions) {
    this.store = store;
    this.maxPendingSessions = maxPendingSessions;
  }

  @Override
  protected Result check() {
    int size = store.size();
    if (size >= maxPendingSessions) {
      return Result.unhealthy("Pending session store full (%d/%d)", size, maxPendingSessions);
    }
    return Result.healthy("pending sessions=%d/%d", size, maxPendingSessions);
  }
}
