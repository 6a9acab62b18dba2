package com.quantori.bqp.core.configuration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Map;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads the platform configuration: explicit overrides first, then system properties, {@code
 * application.conf} and the {@code reference.conf} files of every module on the classpath.
 */
@Slf4j
@UtilityClass
public class BqpConfiguration {

  public static Config load() {
    return load(Map.of());
  }

  public static Config load(Map<String, ?> overrides) {
    Config config = ConfigFactory.parseMap(overrides).withFallback(ConfigFactory.load()).resolve();
    log.debug("Loaded configuration with {} overrides", overrides.size());
    return config;
  }
}
