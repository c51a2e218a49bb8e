package com.mytrainpro.handoff.client.manager;

import com.mytrainpro.handoff.client.deeplink.HandoffTrigger;
import com.mytrainpro.handoff.model.pending.AppSession;

/**
 * A state transition of a handoff attempt.
 *
 * @param state         the new state
 * @param sessionHandle handle being processed
 * @param trigger       path that surfaced the handle
 * @param appSession    the restored session; only set for {@link HandoffState#HANDOFF_COMPLETE}
 */
public record HandoffEvent(HandoffState state, String sessionHandle, HandoffTrigger trigger,
                           AppSession appSession) {
}
