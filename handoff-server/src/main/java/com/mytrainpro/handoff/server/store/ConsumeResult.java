package com.mytrainpro.handoff.server.store;

/**
 * Result of {@link PendingSessionStore#consume(String)}.
 *
 * @param outcome what happened
 * @param session the record as it stands after the call; null for {@link Outcome#NOT_FOUND}
 */
public record ConsumeResult(Outcome outcome, PendingSession session) {

  /**
   * Possible consume outcomes. Only {@link #CONSUMED} changes state.
   */
  public enum Outcome {
    CONSUMED,
    ALREADY_CONSUMED,
    EXPIRED,
    NOT_FOUND
  }

  public static ConsumeResult consumed(PendingSession session) {
    return new ConsumeResult(Outcome.CONSUMED, session);
  }

  public static ConsumeResult alreadyConsumed(PendingSession session) {
    return new ConsumeResult(Outcome.ALREADY_CONSUMED, session);
  }

  public static ConsumeResult expired(PendingSession session) {
    return new ConsumeResult(Outcome.EXPIRED, session);
  }

  public static ConsumeResult notFound() {
    return new ConsumeResult(Outcome.NOT_FOUND, null);
  }
}
