package com.quantori.bqp.core.sequence;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.quantori.bqp.api.ValidationException;
import com.quantori.bqp.api.model.BlastProgram;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.SequenceQuery;
import com.quantori.bqp.api.model.SequenceType;
import com.quantori.bqp.api.model.ServiceType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

class SequenceValidatorTest {
  private static final String DNA = "ATGCGTACGTTAGCATGCGTACGT";
  private static final String PROTEIN = "MKTAYIAKQRQISFVKSHFSRQ";

  @Test
  void cleanDropsHeadersAndForeignCharacters() {
    assertEquals("ATGCGTAC", SequenceValidator.clean(">seq1 some gene\natg cgt\n ac12-\n"));
    assertEquals("", SequenceValidator.clean(null));
    assertEquals("MKT*", SequenceValidator.clean("mkt*"));
  }

  @ParameterizedTest
  @CsvSource({
    "ATGCGTACGTTAGC, DNA",
    "AUGCGUACGUUAGC, DNA_AMBIGUOUS",
    "ATGCNNNNRYATGC, DNA_AMBIGUOUS",
    "MKTAYIAKQRQISF, PROTEIN",
    "ATGCATGCXXXX, UNKNOWN"
  })
  void detectsType(String sequence, SequenceType expected) {
    assertEquals(expected, SequenceValidator.detectType(sequence));
  }

  @Test
  void emptySequenceIsUnknown() {
    assertEquals(SequenceType.UNKNOWN, SequenceValidator.detectType(""));
  }

  @ParameterizedTest
  @EnumSource(BlastProgram.class)
  void shortSequencesFailForEveryProgram(BlastProgram program) {
    SearchRequest request = request(program, "ATGCATGCA");

    ValidationException exception =
        assertThrows(ValidationException.class, () -> SequenceValidator.validate(request));

    assertThat(exception.getMessage(), containsString("at least 10"));
  }

  @Test
  void headerDoesNotCountTowardsLength() {
    assertThrows(
        ValidationException.class, () -> SequenceValidator.validate(">long header line\nATGC"));
  }

  @ParameterizedTest
  @EnumSource(
      value = BlastProgram.class,
      names = {"BLASTN", "BLASTX", "TBLASTN"})
  void proteinQueriesAreRejectedByNucleotidePrograms(BlastProgram program) {
    ValidationException exception =
        assertThrows(
            ValidationException.class,
            () -> SequenceValidator.validate(request(program, PROTEIN)));

    assertThat(exception.getMessage(), containsString("cannot be used with protein sequences"));
  }

  @Test
  void blastpRequiresProtein() {
    ValidationException exception =
        assertThrows(
            ValidationException.class,
            () -> SequenceValidator.validate(request(BlastProgram.BLASTP, DNA)));

    assertThat(exception.getMessage(), is("BLASTP requires a protein sequence, got DNA"));
  }

  @Test
  void compatibleRequestPasses() {
    SequenceQuery query = SequenceValidator.validate(request(BlastProgram.BLASTP, PROTEIN));

    assertEquals(PROTEIN, query.getSequence());
    assertEquals(SequenceType.PROTEIN, query.getType());
  }

  @Test
  void missingFieldsAreReported() {
    assertThrows(ValidationException.class, () -> SequenceValidator.validate((SearchRequest) null));
    assertThrows(
        ValidationException.class,
        () -> SequenceValidator.validate(request(BlastProgram.BLASTN, DNA).toBuilder()
            .program(null).build()));
    assertThrows(
        ValidationException.class,
        () -> SequenceValidator.validate(request(BlastProgram.BLASTN, DNA).toBuilder()
            .database(" ").build()));
    assertThrows(
        ValidationException.class,
        () -> SequenceValidator.validate(request(BlastProgram.BLASTN, DNA).toBuilder()
            .evalueThreshold(0).build()));
    assertThrows(
        ValidationException.class,
        () -> SequenceValidator.validate(request(BlastProgram.BLASTN, DNA).toBuilder()
            .maxTargets(0).build()));
  }

  private static SearchRequest request(BlastProgram program, String sequence) {
    return SearchRequest.builder()
        .sequence(sequence)
        .program(program)
        .service(ServiceType.LOCAL)
        .database("genes")
        .build();
  }
}
