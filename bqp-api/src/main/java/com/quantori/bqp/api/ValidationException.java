package com.quantori.bqp.api;

/**
 * A search request or a query sequence was rejected before any execution was attempted. The
 * message is meant to be shown to the user as is.
 */
public class ValidationException extends BlastException {
  public ValidationException(String message) {
    super(message);
  }
}
