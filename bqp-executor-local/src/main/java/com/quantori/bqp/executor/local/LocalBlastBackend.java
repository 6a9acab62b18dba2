package com.quantori.bqp.executor.local;

import com.quantori.bqp.api.BlastException;
import com.quantori.bqp.api.DatabaseNotFoundException;
import com.quantori.bqp.api.SearchCancelledException;
import com.quantori.bqp.api.model.OutputFormat;
import com.quantori.bqp.api.model.RawOutput;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.SearchStage;
import com.quantori.bqp.api.model.ServiceType;
import com.quantori.bqp.api.service.ExecutionBackend;
import com.quantori.bqp.api.service.SearchMonitor;
import com.quantori.bqp.api.util.DatabaseFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/** Runs searches with the BLAST+ programs installed on this machine. */
@Slf4j
public class LocalBlastBackend implements ExecutionBackend {
  static final String QUERY_HEADER = ">Query_sequence";

  private final LocalBlastProperties properties;
  private final CommandRunner runner;
  private final BlastCommandBuilder commandBuilder;

  public LocalBlastBackend(LocalBlastProperties properties) {
    this(properties, new DefaultCommandRunner());
  }

  public LocalBlastBackend(LocalBlastProperties properties, CommandRunner runner) {
    this.properties = properties;
    this.runner = runner;
    this.commandBuilder = new BlastCommandBuilder(properties);
  }

  @Override
  public ServiceType service() {
    return ServiceType.LOCAL;
  }

  @Override
  public RawOutput execute(SearchRequest request, String databasePath, SearchMonitor monitor) {
    Path base = Path.of(databasePath);
    if (!DatabaseFiles.isComplete(base, request.getProgram().getDatabaseMolType())) {
      throw new DatabaseNotFoundException(
          "Database not found or invalid: " + databasePath + ". Please create the database first.");
    }
    if (monitor.isCancelled()) {
      throw new SearchCancelledException("Search cancelled before start");
    }

    long started = System.nanoTime();
    Path queryFile = writeQuery(request.getSequence());
    try {
      List<String> command = commandBuilder.build(request, queryFile, databasePath);
      monitor.progress(SearchStage.RUNNING, "Running " + request.getProgram().getCommand());
      ProcessResult result =
          runner.run(command, environment(), null, properties.getProcessTimeout());
      if (!result.isSuccess()) {
        throw ProcessFailureClassifier.toException(request.getProgram().getCommand(), result);
      }
      return RawOutput.builder()
          .format(OutputFormat.TABULAR)
          .body(result.getStdout())
          .commandLine(result.getCommandLine())
          .elapsed(Duration.ofNanos(System.nanoTime() - started))
          .build();
    } finally {
      try {
        Files.deleteIfExists(queryFile);
      } catch (IOException e) {
        log.warn("Cannot delete query file {}", queryFile, e);
      }
    }
  }

  private Map<String, String> environment() {
    Map<String, String> environment = new HashMap<>();
    Path databaseDirectory = properties.getDatabaseDirectory();
    if (databaseDirectory != null) {
      try {
        Files.createDirectories(databaseDirectory);
      } catch (IOException e) {
        throw new BlastException("Cannot create database directory " + databaseDirectory, e);
      }
      environment.put("BLASTDB", databaseDirectory.toString());
    }
    return environment;
  }

  private Path writeQuery(String sequence) {
    try {
      Files.createDirectories(properties.getTempDirectory());
      Path file = Files.createTempFile(properties.getTempDirectory(), "blast_query_", ".fasta");
      Files.writeString(file, QUERY_HEADER + "\n" + sequence + "\n", StandardCharsets.UTF_8);
      return file;
    } catch (IOException e) {
      throw new BlastException("Cannot write query file", e);
    }
  }
}
