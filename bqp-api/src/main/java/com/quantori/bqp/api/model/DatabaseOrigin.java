package com.quantori.bqp.api.model;

public enum DatabaseOrigin {
  /** Built by the registry from a user supplied FASTA file. */
  CUSTOM,
  /** Found in the database directory; the registry never rebuilds or deletes its files. */
  DISCOVERED
}
