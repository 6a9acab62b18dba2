package com.quantori.bqp.api.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class MolTypeTest {

  @Test
  void fromDbTypeAcceptsEveryNotation() {
    assertEquals(MolType.NUCLEOTIDE, MolType.fromDbType("nucl"));
    assertEquals(MolType.NUCLEOTIDE, MolType.fromDbType("Nucleotide"));
    assertEquals(MolType.PROTEIN, MolType.fromDbType("prot"));
    assertEquals(MolType.PROTEIN, MolType.fromDbType("PROTEIN"));
    assertThrows(IllegalArgumentException.class, () -> MolType.fromDbType("rna"));
  }

  @Test
  void extensions() {
    assertEquals(List.of(".nhr", ".nin", ".nsq"), MolType.NUCLEOTIDE.getExtensions());
    assertEquals(List.of(".phr", ".pin", ".psq"), MolType.PROTEIN.getExtensions());
  }

  @Test
  void rangeIsOrdered() {
    assertEquals(new Range(5, 40), Range.of(40, 5));
    assertEquals(new Range(1, 1), Range.of(1, 1));
  }
}
