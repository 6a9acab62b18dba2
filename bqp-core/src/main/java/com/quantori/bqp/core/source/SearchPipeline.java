package com.quantori.bqp.core.source;

import com.quantori.bqp.api.DatabaseNotFoundException;
import com.quantori.bqp.api.ResultParseException;
import com.quantori.bqp.api.SearchCancelledException;
import com.quantori.bqp.api.ValidationException;
import com.quantori.bqp.api.model.DatabaseRecord;
import com.quantori.bqp.api.model.Hit;
import com.quantori.bqp.api.model.MolType;
import com.quantori.bqp.api.model.OutputFormat;
import com.quantori.bqp.api.model.QueryInfo;
import com.quantori.bqp.api.model.RawOutput;
import com.quantori.bqp.api.model.ResultSource;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.SearchResult;
import com.quantori.bqp.api.model.SearchStage;
import com.quantori.bqp.api.model.SequenceQuery;
import com.quantori.bqp.api.model.ServiceType;
import com.quantori.bqp.api.model.Statistics;
import com.quantori.bqp.api.service.ExecutionBackend;
import com.quantori.bqp.api.util.DatabaseFiles;
import com.quantori.bqp.core.database.DatabaseRegistry;
import com.quantori.bqp.core.fallback.FallbackResultGenerator;
import com.quantori.bqp.core.parser.ParsedOutput;
import com.quantori.bqp.core.parser.ResultParser;
import com.quantori.bqp.core.parser.TabularResultParser;
import com.quantori.bqp.core.parser.XmlResultParser;
import com.quantori.bqp.core.sequence.SequenceValidator;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * The steps of one search. {@link #prepare} runs every check that can reject a request; its errors
 * reach the caller. {@link #execute} runs the backend and parses its output; its errors, except a
 * cancellation, turn into a simulated result.
 */
@Slf4j
public class SearchPipeline {
  private final Map<ServiceType, ExecutionBackend> backends;
  private final Map<OutputFormat, ResultParser> parsers;
  private final DatabaseRegistry registry;
  private final FallbackResultGenerator fallbackGenerator;

  public SearchPipeline(Collection<ExecutionBackend> backends, DatabaseRegistry registry) {
    this(
        backends,
        List.of(new TabularResultParser(), new XmlResultParser()),
        registry,
        new FallbackResultGenerator());
  }

  public SearchPipeline(
      Collection<ExecutionBackend> backends,
      Collection<ResultParser> parsers,
      DatabaseRegistry registry,
      FallbackResultGenerator fallbackGenerator) {
    this.backends = new EnumMap<>(ServiceType.class);
    backends.forEach(backend -> this.backends.put(backend.service(), backend));
    this.parsers =
        parsers.stream().collect(Collectors.toMap(ResultParser::format, Function.identity()));
    this.registry = registry;
    this.fallbackGenerator = fallbackGenerator;
  }

  PreparedSearch prepare(String searchId, SearchRequest request, ListenerSearchMonitor monitor) {
    monitor.progress(SearchStage.VALIDATING, "Validating query sequence");
    SequenceQuery query = SequenceValidator.validate(request);
    ExecutionBackend backend = backends.get(request.getService());
    if (backend == null) {
      throw new ValidationException("Unsupported BLAST service: " + request.getService());
    }
    PreparedSearch.PreparedSearchBuilder prepared =
        PreparedSearch.builder()
            .searchId(searchId)
            .request(request)
            .query(query)
            .backend(backend);
    if (request.getService() == ServiceType.LOCAL) {
      monitor.progress(
          SearchStage.RESOLVING_DATABASE, "Resolving database " + request.getDatabase());
      if (registry == null) {
        throw new DatabaseNotFoundException("No local database registry is configured");
      }
      Path path = registry.resolvePath(request.getDatabase());
      MolType molType = request.getProgram().getDatabaseMolType();
      if (!DatabaseFiles.isComplete(path, molType)) {
        throw new DatabaseNotFoundException(
            String.format(
                "Database not found or invalid: %s (no %s database at %s). "
                    + "Please create the database first.",
                request.getDatabase(), molType.getLabel(), path));
      }
      prepared.databasePath(path.toString());
      prepared.database(registry.lookup(request.getDatabase()).orElse(null));
    } else {
      prepared.databasePath(request.getDatabase().trim());
    }
    log.info(
        "Search {} prepared: {} {} against {}, query length {}",
        searchId,
        request.getService(),
        request.getProgram().getCommand(),
        request.getDatabase(),
        query.getLength());
    return prepared.build();
  }

  SearchResult execute(PreparedSearch prepared, ListenerSearchMonitor monitor) {
    Instant started = Instant.now();
    SearchRequest request = prepared.getRequest();
    try {
      checkCancelled(prepared, monitor);
      SearchRequest cleaned =
          request.toBuilder().sequence(prepared.getQuery().getSequence()).build();
      RawOutput raw = prepared.getBackend().execute(cleaned, prepared.getDatabasePath(), monitor);
      checkCancelled(prepared, monitor);
      monitor.progress(SearchStage.PARSING, "Parsing results");
      SearchResult result = toResult(prepared, raw, Duration.between(started, Instant.now()));
      monitor.progress(
          SearchStage.COMPLETED, String.format("Found %d hits", result.getHits().size()));
      log.info("Search {} completed with {} hits", prepared.getSearchId(), result.getHits().size());
      return result;
    } catch (SearchCancelledException | ValidationException | DatabaseNotFoundException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Search {} failed, falling back to simulated results", prepared.getSearchId(), e);
      String message = StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName());
      return fallback(prepared, monitor, message, Duration.between(started, Instant.now()));
    }
  }

  /** Simulated result for a search that was still running when its time ran out. */
  SearchResult timedOut(PreparedSearch prepared, ListenerSearchMonitor monitor, Duration limit) {
    return fallback(
        prepared, monitor, String.format("Search did not finish within %s", limit), limit);
  }

  private SearchResult fallback(
      PreparedSearch prepared, ListenerSearchMonitor monitor, String message, Duration elapsed) {
    monitor.progress(SearchStage.FALLBACK, "Search failed: " + message);
    monitor.warning("Showing simulated results: " + message);
    return fallbackGenerator.generate(
        prepared.getSearchId(), prepared.getRequest(), prepared.getQuery(), message, elapsed);
  }

  private SearchResult toResult(PreparedSearch prepared, RawOutput raw, Duration elapsed) {
    ResultParser parser = parsers.get(raw.getFormat());
    if (parser == null) {
      throw new ResultParseException("No parser for output format " + raw.getFormat());
    }
    SearchRequest request = prepared.getRequest();
    ParsedOutput parsed =
        parser.parse(raw.getBody(), prepared.getQuery().getLength(), request.getProgram());
    List<Hit> hits =
        parsed.getHits().stream().limit(request.getMaxTargets()).collect(Collectors.toList());
    boolean local = request.getService() == ServiceType.LOCAL;
    return SearchResult.builder()
        .searchId(prepared.getSearchId())
        .queryInfo(QueryInfo.of(prepared.getQuery()))
        .parameters(request)
        .hits(List.copyOf(hits))
        .statistics(statistics(prepared, parsed.getStatistics(), elapsed))
        .source(local ? ResultSource.LOCAL : ResultSource.REMOTE)
        .realResults(true)
        .remoteJobId(raw.getRemoteJobId())
        .rawOutput(raw.getBody())
        .auditOutput(raw.getAuditText())
        .completedAt(Instant.now())
        .build();
  }

  private static Statistics statistics(
      PreparedSearch prepared, Statistics parsed, Duration elapsed) {
    Statistics.StatisticsBuilder builder =
        parsed == null ? Statistics.builder() : parsed.toBuilder();
    DatabaseRecord database = prepared.getDatabase();
    String name =
        Stream.of(
                parsed == null ? null : parsed.getDatabaseName(),
                database == null ? null : database.getName(),
                prepared.getRequest().getDatabase())
            .filter(StringUtils::isNotBlank)
            .findFirst()
            .orElse(null);
    builder.databaseName(name).searchTimeMillis(elapsed.toMillis());
    if (database != null && (parsed == null || parsed.getSequenceCount() == 0)) {
      builder.sequenceCount(database.getSequenceCount()).letterCount(database.getLetterCount());
    }
    return builder.build();
  }

  private static void checkCancelled(PreparedSearch prepared, ListenerSearchMonitor monitor) {
    if (monitor.isCancelled()) {
      throw new SearchCancelledException("Search " + prepared.getSearchId() + " was cancelled");
    }
  }

  /** Services a backend is registered for. */
  public Collection<ServiceType> services() {
    return backends.keySet();
  }
}
