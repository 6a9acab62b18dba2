package com.quantori.bqp.api;

import lombok.Getter;

/** An external BLAST+ process failed. Carries the captured diagnostic stream. */
@Getter
public class ProcessExecutionException extends BlastException {
  private final ProcessFailureKind kind;
  private final int exitCode;
  private final String diagnostics;

  public ProcessExecutionException(
      ProcessFailureKind kind, int exitCode, String message, String diagnostics) {
    super(message);
    this.kind = kind;
    this.exitCode = exitCode;
    this.diagnostics = diagnostics;
  }

  public ProcessExecutionException(ProcessFailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.exitCode = -1;
    this.diagnostics = cause.getMessage();
  }
}
