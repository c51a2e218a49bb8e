package com.mytrainpro.handoff.server.manager;

import com.mytrainpro.handoff.model.LogMasks;
import com.mytrainpro.handoff.model.pending.AppSession;
import com.mytrainpro.handoff.model.pending.ConsumeStatus;
import com.mytrainpro.handoff.model.pending.PendingConsumeResponse;
import com.mytrainpro.handoff.server.auth.AppSessionManager;
import com.mytrainpro.handoff.server.store.ConsumeResult;
import com.mytrainpro.handoff.server.store.PendingSessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a pending session into the application's ordinary authenticated session.
 * <p>
 * The store's atomic consume decides the single winner; only the winner gets an app session.
 * Every other outcome is reported, not thrown:
 * <ul>
 *   <li>{@code already_consumed} - the other trigger path finished the handoff; a no-op</li>
 *   <li>{@code expired} - past TTL or superseded; the user has to sign in again</li>
 *   <li>{@code not_found} - the handle was never issued; logged as a correctness signal</li>
 * </ul>
 */
public class SessionMaterializer {

  private static final Logger log = LoggerFactory.getLogger(SessionMaterializer.class);

  private final PendingSessionStore pendingSessionStore;
  private final AppSessionManager appSessionManager;

  public SessionMaterializer(PendingSessionStore pendingSessionStore, AppSessionManager appSessionManager) {
    this.pendingSessionStore = pendingSessionStore;
    this.appSessionManager = appSessionManager;
  }

  /**
   * Consumes the pending session and, if this call won, issues the app session.
   *
   * @param sessionHandle handle from the deep link or from a lookup
   * @return the consume response
   */
  public PendingConsumeResponse materialize(String sessionHandle) {
    ConsumeResult result = pendingSessionStore.consume(sessionHandle);
    switch (result.outcome()) {
      case CONSUMED -> {
        AppSession appSession = appSessionManager.issue(result.session().userId());
        log.info("Handoff complete for handle={}", LogMasks.mask(sessionHandle));
        return PendingConsumeResponse.ok(appSession);
      }
      case ALREADY_CONSUMED -> {
        log.debug("Handle={} already consumed by another caller", LogMasks.mask(sessionHandle));
        return PendingConsumeResponse.of(ConsumeStatus.ALREADY_CONSUMED);
      }
      case EXPIRED -> {
        log.debug("Handle={} expired before consumption", LogMasks.mask(sessionHandle));
        return PendingConsumeResponse.of(ConsumeStatus.EXPIRED);
      }
      default -> {
        log.warn("Consume for unknown handle={}; deep link corrupted or forged?", LogMasks.mask(sessionHandle));
        return PendingConsumeResponse.of(ConsumeStatus.NOT_FOUND);
      }
    }
  }
}
