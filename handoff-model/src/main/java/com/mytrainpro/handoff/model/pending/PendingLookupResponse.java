package com.mytrainpro.handoff.model.pending;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model answering a lookup. "Nothing pending" is a normal {@code found=false} answer, never
 * an HTTP error.
 * <p>
 * Used by: {@code POST /auth/pending/lookup} response
 *
 * @param found         whether a live (unconsumed, unexpired) pending session exists
 * @param sessionHandle handle of that session; absent when not found
 * @param userId        user the session belongs to; absent when not found
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PendingLookupResponse(
    @JsonProperty("found") boolean found,
    @JsonProperty("sessionHandle") String sessionHandle,
    @JsonProperty("userId") String userId) {

  /**
   * Response for a device with no live pending session.
   *
   * @return the not-found response
   */
  public static PendingLookupResponse notFound() {
    return new PendingLookupResponse(false, null, null);
  }

  /**
   * Response for a device with a live pending session.
   *
   * @param sessionHandle the handle
   * @param userId        the user
   * @return the found response
   */
  public static PendingLookupResponse found(String sessionHandle, String userId) {
    return new PendingLookupResponse(true, sessionHandle, userId);
  }
}
