package com.quantori.bqp.api;

/** Raw search output cannot be turned into hits at all. */
public class ResultParseException extends BlastException {
  public ResultParseException(String message) {
    super(message);
  }

  public ResultParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
