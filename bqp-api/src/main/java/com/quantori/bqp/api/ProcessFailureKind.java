package com.quantori.bqp.api;

/** Classification of a failed external process. */
public enum ProcessFailureKind {
  /** The executable cannot be found or started. */
  MISSING_EXECUTABLE,
  /** The database files are unreadable or damaged. */
  CORRUPT_DATABASE,
  /** The input handed to the process was rejected. */
  MALFORMED_INPUT,
  /** Any other non-zero exit. */
  GENERIC
}
