package com.quantori.bqp.executor.local;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.quantori.bqp.api.ProcessExecutionException;
import com.quantori.bqp.api.ProcessFailureKind;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ProcessFailureClassifierTest {

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "127|sh: blastn: command not found|MISSING_EXECUTABLE",
        "1|BLAST Database error: No alias or index file found|CORRUPT_DATABASE",
        "1|Database memory map file error|CORRUPT_DATABASE",
        "1|Error: input file is empty|MALFORMED_INPUT",
        "2|query.fasta: No such file or directory|MALFORMED_INPUT",
        "1|FASTA-reader: Ignoring invalid residues|MALFORMED_INPUT",
        "3|Segmentation fault|GENERIC"
      })
  void classifiesDiagnostics(int exitCode, String stderr, ProcessFailureKind expected) {
    assertEquals(expected, ProcessFailureClassifier.classify(exitCode, stderr));
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {"4|out of memory"})
  void exceptionCarriesExitCodeAndDiagnostics(int exitCode, String stderr) {
    ProcessExecutionException exception =
        ProcessFailureClassifier.toException(
            "blastp", new ProcessResult("blastp -query q", exitCode, "", stderr + "\n"));

    assertEquals(ProcessFailureKind.GENERIC, exception.getKind());
    assertEquals(exitCode, exception.getExitCode());
    assertEquals(stderr, exception.getDiagnostics());
    assertEquals("blastp failed with exit code 4", exception.getMessage());
  }
}
