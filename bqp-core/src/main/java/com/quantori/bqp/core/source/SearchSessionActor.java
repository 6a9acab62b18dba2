package com.quantori.bqp.core.source;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.PostStop;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import akka.actor.typed.javadsl.TimerScheduler;
import akka.pattern.StatusReply;
import com.quantori.bqp.api.SearchCancelledException;
import com.quantori.bqp.api.SearchInProgressException;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.SearchResult;
import com.quantori.bqp.api.service.SearchProgressListener;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the searches of one session, one at a time. Checks made before execution run inside the
 * actor and fail the caller directly; execution runs on the blocking dispatcher and reports back
 * with a {@link SearchFinished} message. A search still running when the search timeout fires is
 * cancelled and answered with a simulated result; its late outcome is dropped.
 */
@Slf4j
class SearchSessionActor extends AbstractBehavior<SearchSessionActor.Command> {
  private final TimerScheduler<Command> timers;
  private final String sessionId;
  private final SearchPipeline pipeline;
  private final Duration searchTimeout;
  private final Executor blockingExecutor;
  private ActiveSearch active;

  private SearchSessionActor(
      ActorContext<Command> context,
      TimerScheduler<Command> timers,
      String sessionId,
      SearchPipeline pipeline,
      Duration searchTimeout) {
    super(context);
    this.timers = timers;
    this.sessionId = sessionId;
    this.pipeline = pipeline;
    this.searchTimeout = searchTimeout;
    this.blockingExecutor =
        context.getSystem().dispatchers().lookup(DispatcherSelector.blocking());
  }

  static Behavior<Command> create(
      String sessionId, SearchPipeline pipeline, Duration searchTimeout) {
    return Behaviors.setup(
        ctx ->
            Behaviors.withTimers(
                timers -> new SearchSessionActor(ctx, timers, sessionId, pipeline, searchTimeout)));
  }

  @Override
  public Receive<Command> createReceive() {
    return newReceiveBuilder()
        .onMessage(Search.class, this::onSearch)
        .onMessage(SearchFinished.class, this::onSearchFinished)
        .onMessage(SearchTimedOut.class, this::onSearchTimedOut)
        .onMessage(Cancel.class, this::onCancel)
        .onMessage(Close.class, this::onClose)
        .onSignal(PostStop.class, signal -> onPostStop())
        .build();
  }

  private Behavior<Command> onSearch(Search cmd) {
    if (active != null) {
      log.warn(
          "Session {} rejected a search while {} is running",
          sessionId,
          active.prepared.getSearchId());
      cmd.replyTo.tell(StatusReply.error(new SearchInProgressException(sessionId)));
      return this;
    }
    String searchId = "BLAST_" + UUID.randomUUID();
    ListenerSearchMonitor monitor = new ListenerSearchMonitor(searchId, cmd.listener);
    PreparedSearch prepared;
    try {
      prepared = pipeline.prepare(searchId, cmd.request, monitor);
    } catch (RuntimeException ex) {
      log.info("Search request rejected in session {}: {}", sessionId, ex.getMessage());
      cmd.replyTo.tell(StatusReply.error(ex));
      return this;
    }
    active = new ActiveSearch(prepared, monitor, cmd.replyTo);
    timers.startSingleTimer(
        prepared.getSearchId(), new SearchTimedOut(prepared.getSearchId()), searchTimeout);
    CompletableFuture<SearchResult> execution =
        CompletableFuture.supplyAsync(() -> pipeline.execute(prepared, monitor), blockingExecutor);
    getContext()
        .pipeToSelf(
            execution,
            (result, error) -> new SearchFinished(prepared.getSearchId(), result, error));
    return this;
  }

  private Behavior<Command> onSearchFinished(SearchFinished cmd) {
    if (!isActive(cmd.searchId)) {
      log.debug("Ignoring result of search {} no longer active", cmd.searchId);
      return this;
    }
    timers.cancel(cmd.searchId);
    if (cmd.error == null) {
      active.replyTo.tell(StatusReply.success(cmd.result));
    } else {
      Throwable error = cmd.error instanceof CompletionException ? cmd.error.getCause() : cmd.error;
      log.info("Search {} ended with {}", cmd.searchId, error.toString());
      active.replyTo.tell(StatusReply.error(error));
    }
    active = null;
    return this;
  }

  private Behavior<Command> onSearchTimedOut(SearchTimedOut cmd) {
    if (!isActive(cmd.searchId)) {
      return this;
    }
    log.warn("Search {} did not finish within {}", cmd.searchId, searchTimeout);
    active.monitor.cancel();
    SearchResult result = pipeline.timedOut(active.prepared, active.monitor, searchTimeout);
    active.replyTo.tell(StatusReply.success(result));
    active = null;
    return this;
  }

  private boolean isActive(String searchId) {
    return active != null && active.prepared.getSearchId().equals(searchId);
  }

  private Behavior<Command> onCancel(Cancel cmd) {
    boolean running = active != null;
    if (running) {
      active.monitor.cancel();
    }
    cmd.replyTo.tell(running);
    return this;
  }

  private Behavior<Command> onClose(Close cmd) {
    log.info("Close command was received for session {}", sessionId);
    return Behaviors.stopped();
  }

  private Behavior<Command> onPostStop() {
    if (active != null) {
      active.monitor.cancel();
      active.replyTo.tell(
          StatusReply.error(
              new SearchCancelledException("Session " + sessionId + " was closed")));
      active = null;
    }
    return this;
  }

  interface Command {}

  @AllArgsConstructor
  static class Search implements Command {
    public final SearchRequest request;
    public final SearchProgressListener listener;
    public final ActorRef<StatusReply<SearchResult>> replyTo;
  }

  @AllArgsConstructor
  static class Cancel implements Command {
    public final ActorRef<Boolean> replyTo;
  }

  static class Close implements Command {}

  @AllArgsConstructor
  private static class SearchFinished implements Command {
    final String searchId;
    final SearchResult result;
    final Throwable error;
  }

  @AllArgsConstructor
  private static class SearchTimedOut implements Command {
    final String searchId;
  }

  @AllArgsConstructor
  private static class ActiveSearch {
    final PreparedSearch prepared;
    final ListenerSearchMonitor monitor;
    final ActorRef<StatusReply<SearchResult>> replyTo;
  }
}
