package com.quantori.bqp.api.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Counts reported by the database tools for a built database. */
@Getter
@Builder
@ToString
public class DatabaseInfo {
  private final String title;
  private final long sequenceCount;
  private final long letterCount;
}
