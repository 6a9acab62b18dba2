package com.quantori.bqp.api.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** One aligned segment pair between the query and a subject. */
@Getter
@Builder(toBuilder = true)
@ToString
public class Hsp {
  private final double bitScore;
  private final double rawScore;
  private final double evalue;
  private final int identityCount;
  private final int positiveCount;
  private final int alignmentLength;
  private final int gapCount;
  private final int mismatchCount;
  private final double identityPercent;
  private final double coveragePercent;
  private final Range queryRange;
  private final Range hitRange;
  private final Alignment alignment;
}
