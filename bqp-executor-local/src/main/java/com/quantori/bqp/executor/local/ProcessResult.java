package com.quantori.bqp.executor.local;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(exclude = "stdout")
@AllArgsConstructor
public class ProcessResult {
  private final String commandLine;
  private final int exitCode;
  private final String stdout;
  private final String stderr;

  public boolean isSuccess() {
    return exitCode == 0;
  }
}
