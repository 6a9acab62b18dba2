package com.quantori.bqp.executor.local;

import com.quantori.bqp.api.ProcessExecutionException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/** Finds out which BLAST+ release, if any, the configured executables belong to. */
@Slf4j
public class BlastInstallation {
  static final String BLASTN = "blastn";
  static final Duration VERSION_TIMEOUT = Duration.ofSeconds(30);

  private static final Pattern VERSION = Pattern.compile("blastn: (\\d+(?:\\.\\d+)*)");

  private final LocalBlastProperties properties;
  private final CommandRunner runner;

  public BlastInstallation(LocalBlastProperties properties) {
    this(properties, new DefaultCommandRunner());
  }

  public BlastInstallation(LocalBlastProperties properties, CommandRunner runner) {
    this.properties = properties;
    this.runner = runner;
  }

  /**
   * Runs {@code blastn -version}.
   *
   * @return the installed release such as {@code 2.15.0}, or empty when blastn cannot be run or
   *     its output carries no version
   */
  public Optional<String> version() {
    List<String> command = List.of(properties.executable(BLASTN), "-version");
    ProcessResult result;
    try {
      result = runner.run(command, Map.of(), null, VERSION_TIMEOUT);
    } catch (ProcessExecutionException e) {
      log.warn("BLAST+ not found or not accessible: {}", e.getMessage());
      return Optional.empty();
    }
    if (!result.isSuccess()) {
      log.warn("{} exited with code {}: {}", command, result.getExitCode(), result.getStderr());
      return Optional.empty();
    }
    Matcher matcher = VERSION.matcher(result.getStdout());
    if (!matcher.find()) {
      log.warn("BLAST+ version could not be determined from output of {}", command);
      return Optional.empty();
    }
    log.info("Found BLAST+ installation v{}", matcher.group(1));
    return Optional.of(matcher.group(1));
  }

  public boolean isInstalled() {
    return version().isPresent();
  }
}
