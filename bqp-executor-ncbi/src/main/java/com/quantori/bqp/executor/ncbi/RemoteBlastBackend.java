package com.quantori.bqp.executor.ncbi;

import com.quantori.bqp.api.RemoteJobFailedException;
import com.quantori.bqp.api.RemoteSubmissionException;
import com.quantori.bqp.api.RemoteTimeoutException;
import com.quantori.bqp.api.SearchCancelledException;
import com.quantori.bqp.api.model.OutputFormat;
import com.quantori.bqp.api.model.RawOutput;
import com.quantori.bqp.api.model.RemoteJob;
import com.quantori.bqp.api.model.RemoteJobStatus;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.SearchStage;
import com.quantori.bqp.api.model.ServiceType;
import com.quantori.bqp.api.service.ExecutionBackend;
import com.quantori.bqp.api.service.SearchMonitor;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs searches on the NCBI BLAST service: submit, poll until the job leaves the waiting state,
 * retrieve.
 *
 * <p>Polling sleeps a fixed interval between status checks and gives up after the configured
 * number of attempts or once the job has waited longer than the configured maximum, whichever
 * comes first. {@code FAILED} and {@code UNKNOWN} end the job at once. Cancellation is
 * observed before every sleep and after it; an HTTP call in flight is allowed to complete.
 */
@Slf4j
public class RemoteBlastBackend implements ExecutionBackend {
  static final String XML_FORMAT = "XML";
  static final String TEXT_FORMAT = "Text";

  private final NcbiBlastProperties properties;
  private final NcbiBlastApi api;
  private final Sleeper sleeper;
  private final Clock clock;

  public RemoteBlastBackend(NcbiBlastProperties properties) {
    this(properties, new HttpNcbiBlastApi(properties), Sleeper.THREAD, Clock.systemUTC());
  }

  public RemoteBlastBackend(
      NcbiBlastProperties properties, NcbiBlastApi api, Sleeper sleeper, Clock clock) {
    this.properties = properties;
    this.api = api;
    this.sleeper = sleeper;
    this.clock = clock;
  }

  @Override
  public ServiceType service() {
    return ServiceType.REMOTE;
  }

  @Override
  public RawOutput execute(SearchRequest request, String databasePath, SearchMonitor monitor) {
    Instant started = clock.instant();
    monitor.progress(SearchStage.SUBMITTING, "Submitting search to NCBI BLAST");
    RemoteJob job = submit(request, databasePath, started);
    log.info(
        "Submitted NCBI BLAST job {} (estimated {}s)",
        job.getRequestId(),
        job.getEstimatedSeconds());

    job = awaitCompletion(job, monitor);

    monitor.progress(SearchStage.RETRIEVING, "Retrieving results of job " + job.getRequestId());
    String xml = api.retrieve(job.getRequestId(), XML_FORMAT);
    return RawOutput.builder()
        .format(OutputFormat.XML)
        .body(xml)
        .auditText(auditText(job.getRequestId()))
        .remoteJobId(job.getRequestId())
        .elapsed(Duration.between(started, clock.instant()))
        .build();
  }

  private RemoteJob submit(SearchRequest request, String database, Instant started) {
    String response = api.submit(request, database);
    String requestId =
        NcbiResponseParser.requestId(response)
            .orElseThrow(
                () ->
                    new RemoteSubmissionException(
                        "Failed to submit BLAST job - no RID returned", response));
    return RemoteJob.builder()
        .requestId(requestId)
        .status(RemoteJobStatus.WAITING)
        .startedAt(started)
        .estimatedSeconds(NcbiResponseParser.estimatedSeconds(response))
        .build();
  }

  RemoteJob awaitCompletion(RemoteJob submitted, SearchMonitor monitor) {
    RemoteJob job = submitted;
    int maxAttempts = properties.getMaxAttempts();
    Instant deadline = job.getStartedAt().plus(properties.getMaxWait());
    while (job.getAttempts() < maxAttempts) {
      if (job.getAttempts() > 0 && clock.instant().isAfter(deadline)) {
        log.warn(
            "Job {} still waiting after {}, giving up",
            job.getRequestId(),
            properties.getMaxWait());
        break;
      }
      int attempt = job.getAttempts() + 1;
      RemoteJobStatus status = NcbiResponseParser.status(api.poll(job.getRequestId()));
      job = job.toBuilder().attempts(attempt).status(status).build();
      log.debug("Job {} is {} (attempt {}/{})", job.getRequestId(), status, attempt, maxAttempts);
      switch (status) {
        case READY:
          return job;
        case FAILED:
          throw new RemoteJobFailedException(
              job.getRequestId(), status, "BLAST job failed on NCBI server");
        case UNKNOWN:
          throw new RemoteJobFailedException(
              job.getRequestId(), status, "BLAST job status unknown - may have expired");
        default:
          if (attempt < maxAttempts) {
            monitor.progress(
                SearchStage.POLLING,
                String.format(
                    "Waiting for NCBI BLAST results... (%d/%d)", attempt, maxAttempts));
            pause(job, monitor);
          }
      }
    }
    throw new RemoteTimeoutException(job.getRequestId(), job.getAttempts());
  }

  private void pause(RemoteJob job, SearchMonitor monitor) {
    checkCancelled(job, monitor);
    try {
      sleeper.sleep(properties.getPollInterval());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SearchCancelledException(
          "Interrupted while waiting for job " + job.getRequestId());
    }
    checkCancelled(job, monitor);
  }

  private static void checkCancelled(RemoteJob job, SearchMonitor monitor) {
    if (monitor.isCancelled()) {
      throw new SearchCancelledException(
          "Search cancelled while waiting for job " + job.getRequestId());
    }
  }

  private String auditText(String requestId) {
    try {
      return api.retrieve(requestId, TEXT_FORMAT);
    } catch (RuntimeException e) {
      log.warn("Text report of job {} is not available: {}", requestId, e.getMessage());
      return null;
    }
  }
}
