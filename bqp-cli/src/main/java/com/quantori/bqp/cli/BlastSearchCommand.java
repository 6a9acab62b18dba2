package com.quantori.bqp.cli;

import com.quantori.bqp.api.BlastException;
import com.quantori.bqp.api.ValidationException;
import com.quantori.bqp.api.model.DatabaseRecord;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.SearchResult;
import com.quantori.bqp.api.service.ExecutionBackend;
import com.quantori.bqp.core.configuration.BqpConfiguration;
import com.quantori.bqp.core.configuration.BqpProperties;
import com.quantori.bqp.core.database.DatabaseRegistry;
import com.quantori.bqp.core.database.JsonFileConfigStore;
import com.quantori.bqp.core.export.SearchResultExporter;
import com.quantori.bqp.core.source.BqpService;
import com.quantori.bqp.core.source.SearchPipeline;
import com.quantori.bqp.core.source.SearchSession;
import com.quantori.bqp.executor.local.BlastInstallation;
import com.quantori.bqp.executor.local.LocalBlastBackend;
import com.quantori.bqp.executor.local.LocalBlastProperties;
import com.quantori.bqp.executor.local.MakeBlastDbBuilder;
import com.quantori.bqp.executor.ncbi.NcbiBlastProperties;
import com.quantori.bqp.executor.ncbi.RemoteBlastBackend;
import com.typesafe.config.Config;
import java.io.PrintStream;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import lombok.extern.slf4j.Slf4j;

/** Runs one search from the command line and prints the normalized result. */
@Slf4j
public class BlastSearchCommand {
  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_INVALID = 2;

  private final PrintStream out;
  private final PrintStream err;

  BlastSearchCommand(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    System.exit(new BlastSearchCommand(System.out, System.err).run(args));
  }

  int run(String... args) {
    CliArguments arguments;
    try {
      arguments = CliArguments.parse(args);
    } catch (ValidationException e) {
      err.println(e.getMessage());
      err.println(CliArguments.USAGE);
      return EXIT_INVALID;
    }
    if (arguments.isHelp()) {
      out.println(CliArguments.USAGE);
      return EXIT_OK;
    }

    Config config = BqpConfiguration.load(arguments.getConfigOverrides());
    if (arguments.isCheckInstallation()) {
      return checkInstallation(config);
    }
    DatabaseRegistry registry = createRegistry(config);
    if (arguments.isListDatabases()) {
      registry.list().forEach(record -> out.println(describe(record)));
      return EXIT_OK;
    }

    try {
      SearchRequest request = arguments.toRequest();
      boolean json = arguments.isJson();
      SearchResult result = search(config, registry, request);
      out.println(json ? SearchResultExporter.toJson(result) : SearchResultExporter.toText(result));
      return EXIT_OK;
    } catch (ValidationException e) {
      err.println("Invalid request: " + e.getMessage());
      return EXIT_INVALID;
    } catch (BlastException e) {
      err.println("Search failed: " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  private int checkInstallation(Config config) {
    Optional<String> version =
        new BlastInstallation(LocalBlastProperties.fromConfig(config)).version();
    if (version.isEmpty()) {
      err.println(
          "BLAST+ not found. Local searches need blastn on the PATH or in bqp.local.bin-directory");
      return EXIT_FAILURE;
    }
    out.println("BLAST+ " + version.get());
    return EXIT_OK;
  }

  private SearchResult search(Config config, DatabaseRegistry registry, SearchRequest request) {
    List<ExecutionBackend> backends =
        List.of(
            new LocalBlastBackend(LocalBlastProperties.fromConfig(config)),
            new RemoteBlastBackend(NcbiBlastProperties.fromConfig(config)));
    SearchPipeline pipeline = new SearchPipeline(backends, registry);
    try (BqpService service = new BqpService(pipeline, registry, config);
        SearchSession session = service.openSession().toCompletableFuture().join()) {
      return session
          .search(request, (stage, message) -> log.info("[{}] {}", stage, message))
          .toCompletableFuture()
          .get();
    } catch (ExecutionException | CompletionException e) {
      throw unwrap(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BlastException("Interrupted while waiting for the search", e);
    }
  }

  private static DatabaseRegistry createRegistry(Config config) {
    BqpProperties properties = BqpProperties.fromConfig(config);
    DatabaseRegistry registry =
        new DatabaseRegistry(
            new JsonFileConfigStore(properties.getCatalogFile()),
            new MakeBlastDbBuilder(LocalBlastProperties.fromConfig(config)),
            properties.getDatabaseDirectory());
    registry.load(false);
    if (properties.isDiscoverOnLoad()) {
      try {
        registry.discover();
      } catch (BlastException e) {
        log.warn("Database discovery failed: {}", e.getMessage());
      }
    }
    return registry;
  }

  private static BlastException unwrap(Throwable cause) {
    if (cause instanceof BlastException) {
      return (BlastException) cause;
    }
    return new BlastException(cause);
  }

  private static String describe(DatabaseRecord record) {
    return String.format(
        "%s\t%s\t%s\t%s\t%d sequences\t%s",
        record.getId(),
        record.getName(),
        record.getMolType().getDbType(),
        record.getStatus(),
        record.getSequenceCount(),
        record.getBasePath());
  }
}
