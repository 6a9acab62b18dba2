package com.quantori.bqp.core.configuration;

import com.typesafe.config.Config;
import java.nio.file.Path;
import java.time.Duration;
import lombok.Builder;
import lombok.Data;

@Builder
@Data
public class BqpProperties {
  public static final String PREFIX = "bqp";

  /** Directory searched for databases referenced by name, also the {@code BLASTDB} directory. */
  Path databaseDirectory;

  /** JSON file of the database catalog. */
  Path catalogFile;

  /** How long a caller waits for one search, remote polling included. */
  Duration searchTimeout;

  /** Whether loading the catalog also lists the databases found in the database directory. */
  boolean discoverOnLoad;

  String actorSystemName;

  int maxSessions;

  public static BqpProperties fromConfig(Config root) {
    Config config = root.getConfig(PREFIX);
    return BqpProperties.builder()
        .databaseDirectory(Path.of(config.getString("database-directory")))
        .catalogFile(Path.of(config.getString("catalog-file")))
        .searchTimeout(config.getDuration("search-timeout"))
        .discoverOnLoad(config.getBoolean("discover-on-load"))
        .actorSystemName(config.getString("actor-system-name"))
        .maxSessions(config.getInt("max-sessions"))
        .build();
  }
}
