package com.mytrainpro.handoff.client.manager;

/**
 * Observable states of a single handoff attempt.
 */
public enum HandoffState {
  /** A handle passed the guard and is being consumed. */
  HANDOFF_PENDING,
  /** The session was issued and restored; the app is signed in. */
  HANDOFF_COMPLETE,
  /** The other trigger path already finished the handoff. */
  HANDOFF_NOOP,
  /** The pending session lapsed or was superseded; the user has to sign in again. */
  HANDOFF_EXPIRED,
  /** Unknown handle, exhausted retries or a failed restore. */
  HANDOFF_ERROR
}
