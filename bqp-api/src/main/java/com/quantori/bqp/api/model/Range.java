package com.quantori.bqp.api.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/** Inclusive one-based coordinates on a sequence. */
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class Range {
  private int from;
  private int to;

  /** Orders the coordinates so that {@code from <= to}; minus strand hits come reversed. */
  public static Range of(int start, int end) {
    return new Range(Math.min(start, end), Math.max(start, end));
  }
}
