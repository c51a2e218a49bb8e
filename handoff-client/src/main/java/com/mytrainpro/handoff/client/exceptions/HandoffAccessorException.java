package com.mytrainpro.handoff.client.exceptions;

/**
 * Thrown when a call to the handoff server fails: I/O error, timeout, interruption or a non-2xx
 * response. Callers treat it as transient.
 */
public class HandoffAccessorException extends RuntimeException {

  /**
   * Instantiates a new Handoff accessor exception.
   *
   * @param message the message
   */
  public HandoffAccessorException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Handoff accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public HandoffAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
