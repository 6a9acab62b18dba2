package com.quantori.bqp.api.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum SequenceType {
  DNA("DNA"),
  DNA_AMBIGUOUS("DNA/RNA (with ambiguous bases)"),
  PROTEIN("Protein"),
  UNKNOWN("Unknown");

  private final String label;
}
