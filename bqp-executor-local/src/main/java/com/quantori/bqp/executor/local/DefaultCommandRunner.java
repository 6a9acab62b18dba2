package com.quantori.bqp.executor.local;

import com.quantori.bqp.api.ProcessExecutionException;
import com.quantori.bqp.api.ProcessFailureKind;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class DefaultCommandRunner implements CommandRunner {
  private static final ExecutorService STREAM_READERS =
      Executors.newCachedThreadPool(
          runnable -> {
            Thread thread = new Thread(runnable, "blast-process-reader");
            thread.setDaemon(true);
            return thread;
          });

  @Override
  public ProcessResult run(
      List<String> command,
      Map<String, String> environment,
      Path workingDirectory,
      Duration timeout) {
    String commandLine = String.join(" ", command);
    log.debug("Running: {}", commandLine);
    ProcessBuilder builder = new ProcessBuilder(command);
    builder.environment().putAll(environment);
    if (workingDirectory != null) {
      builder.directory(workingDirectory.toFile());
    }
    Process process;
    try {
      process = builder.start();
    } catch (IOException e) {
      throw new ProcessExecutionException(
          ProcessFailureKind.MISSING_EXECUTABLE,
          "Cannot start " + command.get(0) + ": " + e.getMessage(),
          e);
    }
    CompletableFuture<String> stdout = read(process.getInputStream());
    CompletableFuture<String> stderr = read(process.getErrorStream());
    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new ProcessExecutionException(
            ProcessFailureKind.GENERIC,
            -1,
            String.format("%s did not finish within %s", command.get(0), timeout),
            stderr.getNow(""));
      }
      ProcessResult result =
          new ProcessResult(commandLine, process.exitValue(), stdout.get(), stderr.get());
      log.debug("{} exited with code {}", command.get(0), result.getExitCode());
      return result;
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new ProcessExecutionException(
          ProcessFailureKind.GENERIC, "Interrupted while running " + command.get(0), e);
    } catch (ExecutionException e) {
      throw new ProcessExecutionException(
          ProcessFailureKind.GENERIC, "Cannot read output of " + command.get(0), e.getCause());
    }
  }

  private static CompletableFuture<String> read(InputStream stream) {
    return CompletableFuture.supplyAsync(
        () -> {
          try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        },
        STREAM_READERS);
  }
}
