package com.quantori.bqp.api;

/** Database files exist but the search tools cannot read them. */
public class DatabaseCorruptException extends BlastException {
  public DatabaseCorruptException(String message) {
    super(message);
  }

  public DatabaseCorruptException(String message, Throwable cause) {
    super(message, cause);
  }
}
