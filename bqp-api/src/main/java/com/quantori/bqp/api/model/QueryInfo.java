package com.quantori.bqp.api.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class QueryInfo {
  private final String preview;
  private final int length;
  private final SequenceType type;

  public static QueryInfo of(SequenceQuery query) {
    return QueryInfo.builder()
        .preview(query.getPreview())
        .length(query.getLength())
        .type(query.getType())
        .build();
  }
}
