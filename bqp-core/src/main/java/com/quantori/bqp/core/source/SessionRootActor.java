package com.quantori.bqp.core.source;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import akka.pattern.StatusReply;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Guardian of the search sessions: spawns them and keeps track of the live ones. */
@Slf4j
class SessionRootActor extends AbstractBehavior<SessionRootActor.Command> {
  private final SearchPipeline pipeline;
  private final int maxSessions;
  private final Duration searchTimeout;
  private final Map<String, ActorRef<SearchSessionActor.Command>> sessions = new HashMap<>();

  private SessionRootActor(
      ActorContext<Command> context,
      SearchPipeline pipeline,
      int maxSessions,
      Duration searchTimeout) {
    super(context);
    this.pipeline = pipeline;
    this.maxSessions = maxSessions;
    this.searchTimeout = searchTimeout;
  }

  static Behavior<Command> create(
      SearchPipeline pipeline, int maxSessions, Duration searchTimeout) {
    return Behaviors.setup(
        context -> new SessionRootActor(context, pipeline, maxSessions, searchTimeout));
  }

  @Override
  public Receive<Command> createReceive() {
    return newReceiveBuilder()
        .onMessage(CreateSession.class, this::onCreateSession)
        .onMessage(CountSessions.class, this::onCountSessions)
        .onMessage(SessionStopped.class, this::onSessionStopped)
        .build();
  }

  private Behavior<Command> onCreateSession(CreateSession cmd) {
    if (sessions.size() >= maxSessions) {
      cmd.replyTo.tell(
          StatusReply.error("Maximum number of search sessions reached: " + maxSessions));
      return this;
    }
    ActorRef<SearchSessionActor.Command> sessionRef =
        getContext()
            .spawn(
                SearchSessionActor.create(cmd.sessionId, pipeline, searchTimeout),
                "session-" + cmd.sessionId);
    getContext().watchWith(sessionRef, new SessionStopped(cmd.sessionId));
    sessions.put(cmd.sessionId, sessionRef);
    log.debug("Created search session actor: {}", sessionRef);
    cmd.replyTo.tell(StatusReply.success(sessionRef));
    return this;
  }

  private Behavior<Command> onCountSessions(CountSessions cmd) {
    cmd.replyTo.tell(sessions.size());
    return this;
  }

  private Behavior<Command> onSessionStopped(SessionStopped cmd) {
    sessions.remove(cmd.sessionId);
    log.debug("Search session {} stopped", cmd.sessionId);
    return this;
  }

  interface Command {}

  @AllArgsConstructor
  static class CreateSession implements Command {
    public final String sessionId;
    public final ActorRef<StatusReply<ActorRef<SearchSessionActor.Command>>> replyTo;
  }

  @AllArgsConstructor
  static class CountSessions implements Command {
    public final ActorRef<Integer> replyTo;
  }

  @AllArgsConstructor
  private static class SessionStopped implements Command {
    final String sessionId;
  }
}
