package com.quantori.bqp.api.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class BlastProgramTest {

  @Test
  void blastpAcceptsOnlyProtein() {
    assertTrue(BlastProgram.BLASTP.accepts(SequenceType.PROTEIN));
    assertFalse(BlastProgram.BLASTP.accepts(SequenceType.DNA));
    assertFalse(BlastProgram.BLASTP.accepts(SequenceType.DNA_AMBIGUOUS));
    assertFalse(BlastProgram.BLASTP.accepts(SequenceType.UNKNOWN));
  }

  @ParameterizedTest
  @EnumSource(
      value = BlastProgram.class,
      names = {"BLASTN", "BLASTX", "TBLASTN"})
  void nucleotideProgramsRejectProtein(BlastProgram program) {
    assertFalse(program.accepts(SequenceType.PROTEIN));
    assertTrue(program.accepts(SequenceType.DNA));
    assertTrue(program.accepts(SequenceType.DNA_AMBIGUOUS));
  }

  @Test
  void fromCommand() {
    assertEquals(BlastProgram.TBLASTN, BlastProgram.fromCommand(" tblastn "));
    assertEquals(BlastProgram.BLASTX, BlastProgram.fromCommand("BLASTX"));
    assertThrows(IllegalArgumentException.class, () -> BlastProgram.fromCommand("psiblast"));
  }

  @Test
  void databaseMolType() {
    assertEquals(MolType.NUCLEOTIDE, BlastProgram.BLASTN.getDatabaseMolType());
    assertEquals(MolType.PROTEIN, BlastProgram.BLASTX.getDatabaseMolType());
    assertEquals(MolType.NUCLEOTIDE, BlastProgram.TBLASTN.getDatabaseMolType());
  }
}
