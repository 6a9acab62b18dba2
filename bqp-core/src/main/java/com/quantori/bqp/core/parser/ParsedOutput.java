package com.quantori.bqp.core.parser;

import com.quantori.bqp.api.model.Hit;
import com.quantori.bqp.api.model.Statistics;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Hits and statistics read from one raw output, before they are put into a result. */
@Getter
@Builder
public class ParsedOutput {
  private final List<Hit> hits;

  /** Statistics found in the output itself; null when the format carries none. */
  private final Statistics statistics;

  /** Data lines that could not be read and were skipped. */
  private final int rejectedLines;
}
