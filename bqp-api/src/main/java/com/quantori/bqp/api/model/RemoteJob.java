package com.quantori.bqp.api.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** A job submitted to the remote search service. */
@Getter
@Builder(toBuilder = true)
@ToString
public class RemoteJob {
  private final String requestId;
  private final RemoteJobStatus status;
  private final int attempts;
  private final Instant startedAt;

  /** Estimated time to completion announced by the service on submission, in seconds. */
  private final Integer estimatedSeconds;
}
