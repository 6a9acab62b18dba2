package com.quantori.bqp.core.source;

import akka.actor.typed.ActorRef;
import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.AskPattern;
import com.quantori.bqp.core.configuration.BqpProperties;
import com.quantori.bqp.core.database.DatabaseRegistry;
import com.typesafe.config.Config;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/** Entry point of the search engine: owns the actor system and opens search sessions. */
@Slf4j
public class BqpService implements AutoCloseable {
  private final ActorSystem<SessionRootActor.Command> actorSystem;
  private final Duration searchTimeout;
  @Getter private final DatabaseRegistry registry;

  public BqpService(SearchPipeline pipeline, DatabaseRegistry registry, Config config) {
    BqpProperties properties = BqpProperties.fromConfig(config);
    this.registry = registry;
    this.searchTimeout = properties.getSearchTimeout();
    this.actorSystem =
        ActorSystem.create(
            SessionRootActor.create(
                pipeline, properties.getMaxSessions(), properties.getSearchTimeout()),
            properties.getActorSystemName(),
            config);
    log.info(
        "Search service started with backends for {}, search timeout {}",
        pipeline.services(),
        searchTimeout);
  }

  public CompletionStage<SearchSession> openSession() {
    String sessionId = UUID.randomUUID().toString();
    CompletionStage<ActorRef<SearchSessionActor.Command>> sessionRef =
        AskPattern.askWithStatus(
            actorSystem,
            replyTo -> new SessionRootActor.CreateSession(sessionId, replyTo),
            Duration.ofMinutes(1),
            actorSystem.scheduler());
    return sessionRef.thenApply(
        ref -> new SearchSession(sessionId, ref, actorSystem.scheduler(), searchTimeout));
  }

  public CompletionStage<Integer> countSessions() {
    return AskPattern.ask(
        actorSystem,
        SessionRootActor.CountSessions::new,
        Duration.ofMinutes(1),
        actorSystem.scheduler());
  }

  @Override
  public void close() {
    actorSystem.terminate();
    try {
      actorSystem.getWhenTerminated().toCompletableFuture().get(30, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while stopping the actor system");
    } catch (Exception e) {
      log.warn("Actor system did not stop in time", e);
    }
  }
}
