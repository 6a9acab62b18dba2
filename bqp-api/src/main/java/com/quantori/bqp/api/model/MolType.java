package com.quantori.bqp.api.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** Molecule class of a search database. */
@Getter
@AllArgsConstructor
public enum MolType {
  NUCLEOTIDE("nucl", "nucleotide", List.of(".nhr", ".nin", ".nsq")),
  PROTEIN("prot", "protein", List.of(".phr", ".pin", ".psq"));

  /** Value of the {@code -dbtype} switch of the database builder. */
  private final String dbType;

  private final String label;

  /** File extensions every built database of this class has. */
  private final List<String> extensions;

  public static MolType fromDbType(String value) {
    for (MolType molType : values()) {
      if (molType.dbType.equalsIgnoreCase(value)
          || molType.label.equalsIgnoreCase(value)
          || molType.name().equalsIgnoreCase(value)) {
        return molType;
      }
    }
    throw new IllegalArgumentException("Unknown molecule type: " + value);
  }
}
