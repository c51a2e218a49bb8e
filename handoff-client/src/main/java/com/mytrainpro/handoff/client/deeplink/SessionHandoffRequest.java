package com.mytrainpro.handoff.client.deeplink;

/**
 * A candidate session handle waiting to be materialized.
 *
 * @param sessionHandle the pending session handle
 * @param userId        user id reported alongside the handle; diagnostic only, may be null
 * @param trigger       the path that produced the candidate
 */
public record SessionHandoffRequest(String sessionHandle, String userId, HandoffTrigger trigger) {
}
