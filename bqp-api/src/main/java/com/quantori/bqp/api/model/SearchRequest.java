package com.quantori.bqp.api.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
public class SearchRequest {
  public static final double DEFAULT_EVALUE = 10;
  public static final int DEFAULT_MAX_TARGETS = 50;

  /** Raw query text, possibly with FASTA header lines. */
  private final String sequence;

  private final BlastProgram program;
  private final ServiceType service;

  /** Database reference, resolved by the registry for local searches. */
  private final String database;

  @Builder.Default private final double evalueThreshold = DEFAULT_EVALUE;
  @Builder.Default private final int maxTargets = DEFAULT_MAX_TARGETS;
  private final AdvancedParameters advanced;
}
