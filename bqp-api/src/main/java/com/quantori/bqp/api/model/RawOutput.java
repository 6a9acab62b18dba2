package com.quantori.bqp.api.model;

import java.time.Duration;
import lombok.Builder;
import lombok.Getter;

/** Unparsed output of one backend execution. */
@Getter
@Builder
public class RawOutput {
  private final OutputFormat format;
  private final String body;

  /** Human readable copy of the same result, when the backend could obtain one. */
  private final String auditText;

  /** Command line of a local run. */
  private final String commandLine;

  /** Request id of a remote run. */
  private final String remoteJobId;

  private final Duration elapsed;
}
