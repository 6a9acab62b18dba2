package com.quantori.bqp.api.model;

/** Steps of a search reported to progress listeners. */
public enum SearchStage {
  VALIDATING,
  RESOLVING_DATABASE,
  RUNNING,
  SUBMITTING,
  POLLING,
  RETRIEVING,
  PARSING,
  FALLBACK,
  COMPLETED
}
