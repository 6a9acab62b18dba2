package com.quantori.bqp.core.configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BqpPropertiesTest {

  @Test
  void defaultsComeFromReferenceConfiguration() {
    BqpProperties properties = BqpProperties.fromConfig(BqpConfiguration.load());

    assertEquals(Duration.ofMinutes(35), properties.getSearchTimeout());
    assertTrue(properties.isDiscoverOnLoad());
    assertEquals("bqp-akka-system", properties.getActorSystemName());
    assertEquals(100, properties.getMaxSessions());
    assertTrue(properties.getCatalogFile().endsWith("databases.json"));
  }

  @Test
  void overridesWin() {
    BqpProperties properties =
        BqpProperties.fromConfig(
            BqpConfiguration.load(
                Map.of(
                    "bqp.database-directory", "/data/blast",
                    "bqp.search-timeout", "30s",
                    "bqp.discover-on-load", "false")));

    assertEquals(Path.of("/data/blast"), properties.getDatabaseDirectory());
    assertEquals(Duration.ofSeconds(30), properties.getSearchTimeout());
    assertFalse(properties.isDiscoverOnLoad());
  }
}
