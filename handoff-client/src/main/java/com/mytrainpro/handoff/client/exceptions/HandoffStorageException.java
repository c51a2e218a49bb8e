package com.mytrainpro.handoff.client.exceptions;

/**
 * Thrown when durable client state cannot be read or written.
 */
public class HandoffStorageException extends RuntimeException {

  public HandoffStorageException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
