package com.mytrainpro.handoff.model.pending;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model answering a consume call. All four outcomes travel as HTTP 200; only
 * {@link ConsumeStatus#OK} carries an app session.
 * <p>
 * Used by: {@code POST /auth/pending/consume} response
 *
 * @param status     outcome of the consume
 * @param appSession the issued session when {@code status} is {@code ok}, otherwise absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PendingConsumeResponse(
    @JsonProperty("status") ConsumeStatus status,
    @JsonProperty("appSession") AppSession appSession) {

  public static PendingConsumeResponse ok(AppSession appSession) {
    return new PendingConsumeResponse(ConsumeStatus.OK, appSession);
  }

  public static PendingConsumeResponse of(ConsumeStatus status) {
    return new PendingConsumeResponse(status, null);
  }
}
