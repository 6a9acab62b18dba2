package com.quantori.bqp.api.model;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A database sequence similar to the query. Score fields describe the primary (best) segment
 * pair, {@link #getHsps()} holds every segment pair in rank order, the primary one included.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class Hit {
  private final String accession;
  private final String description;
  private final String organism;
  private final int subjectLength;
  private final double evalue;
  private final double bitScore;
  private final double rawScore;
  private final double identityPercent;
  private final int identityCount;
  private final int positiveCount;
  private final double coveragePercent;
  private final int alignmentLength;
  private final int gapCount;
  private final int mismatchCount;
  private final Range queryRange;
  private final Range hitRange;
  private final Alignment alignment;
  private final List<Hsp> hsps;

  /** Builds a hit whose score fields are taken from {@code primary}. */
  public static HitBuilder fromPrimary(Hsp primary) {
    return Hit.builder()
        .evalue(primary.getEvalue())
        .bitScore(primary.getBitScore())
        .rawScore(primary.getRawScore())
        .identityPercent(primary.getIdentityPercent())
        .identityCount(primary.getIdentityCount())
        .positiveCount(primary.getPositiveCount())
        .coveragePercent(primary.getCoveragePercent())
        .alignmentLength(primary.getAlignmentLength())
        .gapCount(primary.getGapCount())
        .mismatchCount(primary.getMismatchCount())
        .queryRange(primary.getQueryRange())
        .hitRange(primary.getHitRange())
        .alignment(primary.getAlignment());
  }
}
