package com.quantori.bqp.api.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Database size and score model constants of one search. */
@Getter
@Builder(toBuilder = true)
@ToString
public class Statistics {
  private final String databaseName;
  private final long sequenceCount;
  private final long letterCount;
  private final long searchTimeMillis;
  private final double effectiveSearchSpace;
  private final double kappa;
  private final double lambda;
  private final double entropy;
}
