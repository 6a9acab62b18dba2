package com.quantori.bqp.executor.ncbi;

import com.typesafe.config.Config;
import java.net.URI;
import java.time.Duration;
import lombok.Builder;
import lombok.Data;

@Builder
@Data
public class NcbiBlastProperties {
  public static final String PREFIX = "bqp.ncbi";
  public static final URI DEFAULT_URL =
      URI.create("https://blast.ncbi.nlm.nih.gov/blast/Blast.cgi");

  @Builder.Default URI url = DEFAULT_URL;
  @Builder.Default Duration pollInterval = Duration.ofSeconds(5);
  @Builder.Default int maxAttempts = 60;

  /** Longest time a job may stay in the waiting state, counted from submission. */
  @Builder.Default Duration maxWait = Duration.ofMinutes(5);

  @Builder.Default Duration connectTimeout = Duration.ofSeconds(10);
  @Builder.Default Duration requestTimeout = Duration.ofMinutes(2);
  String tool;
  String email;

  public static NcbiBlastProperties fromConfig(Config root) {
    Config config = root.getConfig(PREFIX);
    return NcbiBlastProperties.builder()
        .url(URI.create(config.getString("url")))
        .pollInterval(config.getDuration("poll-interval"))
        .maxAttempts(config.getInt("max-attempts"))
        .maxWait(config.getDuration("max-wait"))
        .connectTimeout(config.getDuration("connect-timeout"))
        .requestTimeout(config.getDuration("request-timeout"))
        .tool(config.getString("tool"))
        .email(config.getString("email"))
        .build();
  }
}
