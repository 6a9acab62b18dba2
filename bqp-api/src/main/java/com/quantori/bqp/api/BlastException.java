package com.quantori.bqp.api;

/**
 * A generic error that is thrown by the platform when a search or a database operation cannot be
 * processed. Every more specific error of the platform extends it.
 */
public class BlastException extends RuntimeException {
  /**
   * Constructs a {@code BlastException} with the specified detail message.
   *
   * @param message the detail message, or null
   */
  public BlastException(String message) {
    super(message);
  }

  /**
   * Constructs a {@code BlastException} as a wrapper of original error.
   *
   * @param t original error
   */
  public BlastException(Throwable t) {
    super(t);
  }

  /**
   * Constructs a {@code BlastException} with the specified detail message and cause.
   *
   * @param message the detail message, or null
   * @param cause the cause
   */
  public BlastException(String message, Throwable cause) {
    super(message, cause);
  }
}
