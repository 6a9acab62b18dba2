package com.quantori.bqp.api;

/** A database with the same name is already registered. */
public class DatabaseAlreadyExistsException extends BlastException {
  public DatabaseAlreadyExistsException(String databaseName) {
    super(String.format("Database with name \"%s\" already exists", databaseName));
  }
}
