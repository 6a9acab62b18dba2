package com.quantori.bqp.api.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class Alignment {
  public static final Alignment EMPTY = new Alignment("", "", "");

  private String query;
  private String subject;
  private String matchLine;

  public boolean hasSequences() {
    return !query.isEmpty() && !subject.isEmpty();
  }
}
