package com.quantori.bqp.executor.local;

import com.quantori.bqp.api.ProcessExecutionException;
import com.quantori.bqp.api.ProcessFailureKind;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

/** Turns a failed BLAST+ process into a {@link ProcessExecutionException}. */
@UtilityClass
class ProcessFailureClassifier {
  static final int COMMAND_NOT_FOUND_EXIT = 127;

  static ProcessFailureKind classify(int exitCode, String stderr) {
    if (exitCode == COMMAND_NOT_FOUND_EXIT
        || StringUtils.containsIgnoreCase(stderr, "command not found")) {
      return ProcessFailureKind.MISSING_EXECUTABLE;
    }
    if (StringUtils.containsAny(stderr, "BLAST Database error", "memory map file error")) {
      return ProcessFailureKind.CORRUPT_DATABASE;
    }
    if (StringUtils.containsAny(stderr, "is empty", "No such file or directory", "FASTA-reader")) {
      return ProcessFailureKind.MALFORMED_INPUT;
    }
    return ProcessFailureKind.GENERIC;
  }

  static ProcessExecutionException toException(String tool, ProcessResult result) {
    ProcessFailureKind kind = classify(result.getExitCode(), result.getStderr());
    String message;
    switch (kind) {
      case MISSING_EXECUTABLE:
        message = tool + " was not found, check that BLAST+ is installed";
        break;
      case CORRUPT_DATABASE:
        message = "Database is corrupted or inaccessible";
        break;
      case MALFORMED_INPUT:
        message = "Input file is empty, missing or unreadable";
        break;
      default:
        message = String.format("%s failed with exit code %d", tool, result.getExitCode());
    }
    return new ProcessExecutionException(
        kind, result.getExitCode(), message, StringUtils.trimToEmpty(result.getStderr()));
  }
}
