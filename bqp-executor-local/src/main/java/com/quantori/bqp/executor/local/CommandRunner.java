package com.quantori.bqp.executor.local;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/** Runs an external program to completion. */
public interface CommandRunner {
  /**
   * Run a program and capture its output.
   *
   * @param command program and its arguments
   * @param environment variables added to the inherited environment
   * @param workingDirectory working directory, or null for the current one
   * @param timeout how long the program may run
   * @return exit code and captured streams; a non-zero exit is not an error at this level
   * @throws com.quantori.bqp.api.ProcessExecutionException if the program cannot be started or
   *     runs out of time
   */
  ProcessResult run(
      List<String> command,
      Map<String, String> environment,
      Path workingDirectory,
      Duration timeout);
}
