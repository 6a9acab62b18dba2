package com.quantori.bqp.api.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder(toBuilder = true)
public class SearchResult {
  private final String searchId;
  private final QueryInfo queryInfo;

  /** The request exactly as the caller sent it. */
  private final SearchRequest parameters;

  /** Best hit first: descending bit score, then ascending e-value. */
  private final List<Hit> hits;

  private final Statistics statistics;
  private final ResultSource source;

  /**
   * False only for results synthesized after a failed execution. Consumers must rely on this flag
   * and never on the shape of the hits.
   */
  private final boolean realResults;

  /** Message of the error that caused a synthesized result. */
  private final String errorMessage;

  private final String remoteJobId;
  private final String rawOutput;
  private final String auditOutput;
  private final Instant completedAt;
}
