package com.quantori.bqp.api;

/**
 * A source file handed to the database builder is not a FASTA file. Thrown before the builder is
 * invoked.
 */
public class UnsupportedFormatException extends BlastException {
  public UnsupportedFormatException(String message) {
    super(message);
  }
}
