package com.quantori.bqp.api.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Optional tuning switches of a search. A {@code null} value means the program default. */
@Getter
@Builder(toBuilder = true)
@ToString
public class AdvancedParameters {
  private final Integer wordSize;
  private final String matrix;
  private final Integer gapOpen;
  private final Integer gapExtend;
  private final boolean lowComplexityFilter;
}
