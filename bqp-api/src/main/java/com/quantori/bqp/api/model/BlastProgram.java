package com.quantori.bqp.api.model;

import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum BlastProgram {
  BLASTN("blastn", MolType.NUCLEOTIDE),
  BLASTP("blastp", MolType.PROTEIN),
  BLASTX("blastx", MolType.PROTEIN),
  TBLASTN("tblastn", MolType.NUCLEOTIDE);

  /** Executable name and value of the remote {@code PROGRAM} parameter. */
  private final String command;

  /** Molecule class of the databases the program searches. */
  private final MolType databaseMolType;

  /**
   * Only {@code blastp} takes protein queries. Every other program refuses them, and {@code blastp}
   * refuses everything else.
   */
  public boolean accepts(SequenceType sequenceType) {
    if (this == BLASTP) {
      return sequenceType == SequenceType.PROTEIN;
    }
    return sequenceType != SequenceType.PROTEIN;
  }

  public boolean isProteinScoring() {
    return this != BLASTN;
  }

  public static BlastProgram fromCommand(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
