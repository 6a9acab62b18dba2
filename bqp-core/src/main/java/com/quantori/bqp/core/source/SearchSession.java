package com.quantori.bqp.core.source;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Scheduler;
import akka.actor.typed.javadsl.AskPattern;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.SearchResult;
import com.quantori.bqp.api.service.SearchProgressListener;
import java.time.Duration;
import java.util.concurrent.CompletionStage;
import lombok.Getter;

/**
 * A conversation with the search engine. A session runs at most one search at a time; a search
 * requested while another one runs fails with {@link
 * com.quantori.bqp.api.SearchInProgressException}.
 */
public class SearchSession implements AutoCloseable {
  /** The session actor answers a search by the search timeout, so the ask waits a little longer. */
  static final Duration REPLY_MARGIN = Duration.ofMinutes(1);


  @Getter private final String sessionId;
  private final ActorRef<SearchSessionActor.Command> actorRef;
  private final Scheduler scheduler;
  private final Duration searchTimeout;

  SearchSession(
      String sessionId,
      ActorRef<SearchSessionActor.Command> actorRef,
      Scheduler scheduler,
      Duration searchTimeout) {
    this.sessionId = sessionId;
    this.actorRef = actorRef;
    this.scheduler = scheduler;
    this.searchTimeout = searchTimeout;
  }

  /**
   * Runs a search. The stage fails with a {@link com.quantori.bqp.api.ValidationException} or a
   * {@link com.quantori.bqp.api.DatabaseNotFoundException} when the request is rejected before
   * execution and with a {@link com.quantori.bqp.api.SearchCancelledException} when the search is
   * cancelled. Every other failure, running past the search timeout included, gives a simulated
   * result.
   */
  public CompletionStage<SearchResult> search(
      SearchRequest request, SearchProgressListener listener) {
    return AskPattern.askWithStatus(
        actorRef,
        replyTo -> new SearchSessionActor.Search(request, listener, replyTo),
        searchTimeout.plus(REPLY_MARGIN),
        scheduler);
  }

  public CompletionStage<SearchResult> search(SearchRequest request) {
    return search(request, SearchProgressListener.NONE);
  }

  /**
   * Asks the running search to stop. A remote search stops before its next poll; a local search
   * stops once its process has ended.
   *
   * @return true if a search was running
   */
  public CompletionStage<Boolean> cancel() {
    return AskPattern.ask(
        actorRef, SearchSessionActor.Cancel::new, Duration.ofMinutes(1), scheduler);
  }

  @Override
  public void close() {
    actorRef.tell(new SearchSessionActor.Close());
  }
}
