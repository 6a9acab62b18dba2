package com.quantori.bqp.executor.local;

import com.typesafe.config.Config;
import java.nio.file.Path;
import java.time.Duration;
import lombok.Builder;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

@Builder
@Data
public class LocalBlastProperties {
  public static final String PREFIX = "bqp.local";

  /** Directory of the BLAST+ executables; null to look them up on the {@code PATH}. */
  Path binDirectory;

  /** Value of {@code BLASTDB} for every BLAST+ process. */
  Path databaseDirectory;

  /** Where query files are staged. */
  Path tempDirectory;

  Duration processTimeout;

  @Builder.Default int defaultWordSize = 11;
  @Builder.Default String defaultMatrix = "BLOSUM62";
  @Builder.Default int defaultGapOpen = 11;
  @Builder.Default int defaultGapExtend = 1;

  public static LocalBlastProperties fromConfig(Config root) {
    Config config = root.getConfig(PREFIX);
    String binDirectory = config.getString("bin-directory");
    return LocalBlastProperties.builder()
        .binDirectory(StringUtils.isBlank(binDirectory) ? null : Path.of(binDirectory))
        .databaseDirectory(
            root.hasPath("bqp.database-directory")
                ? Path.of(root.getString("bqp.database-directory"))
                : null)
        .tempDirectory(Path.of(config.getString("temp-directory")))
        .processTimeout(config.getDuration("process-timeout"))
        .defaultWordSize(config.getInt("blastn.word-size"))
        .defaultMatrix(config.getString("blastp.matrix"))
        .defaultGapOpen(config.getInt("blastp.gap-open"))
        .defaultGapExtend(config.getInt("blastp.gap-extend"))
        .build();
  }

  /** Full path of a BLAST+ tool, or its bare name when no bin directory is set. */
  public String executable(String tool) {
    return binDirectory == null ? tool : binDirectory.resolve(tool).toString();
  }
}
