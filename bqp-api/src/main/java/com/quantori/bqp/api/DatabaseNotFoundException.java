package com.quantori.bqp.api;

/** A database reference cannot be resolved or its files are missing on disk. */
public class DatabaseNotFoundException extends BlastException {
  public DatabaseNotFoundException(String message) {
    super(message);
  }
}
