package com.quantori.bqp.api.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** A cleaned and classified query sequence. */
@Getter
@Builder
@ToString
public class SequenceQuery {
  public static final int PREVIEW_LENGTH = 100;

  private final String sequence;
  private final SequenceType type;

  public int getLength() {
    return sequence.length();
  }

  public String getPreview() {
    if (sequence.length() <= PREVIEW_LENGTH) {
      return sequence;
    }
    return sequence.substring(0, PREVIEW_LENGTH) + "...";
  }
}
