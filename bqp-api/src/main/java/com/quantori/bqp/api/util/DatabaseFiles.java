package com.quantori.bqp.api.util;

import com.quantori.bqp.api.model.MolType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/** Naming rules of the files that make up a search database. */
@Slf4j
@UtilityClass
public class DatabaseFiles {
  private static final List<String> ARTIFACT_SUFFIXES =
      List.of("hr", "in", "sq", "db", "ot", "tf", "to", "js", "og", "sd", "si", "al");

  public static Path withSuffix(Path base, String suffix) {
    return base.resolveSibling(base.getFileName().toString() + suffix);
  }

  /** The index, header and sequence files every database of {@code molType} has. */
  public static List<Path> expectedFiles(Path base, MolType molType) {
    return molType.getExtensions().stream()
        .map(extension -> withSuffix(base, extension))
        .collect(Collectors.toList());
  }

  /** Alias file of a multi-volume database, {@code .nal} or {@code .pal}. */
  public static Path aliasFile(Path base, MolType molType) {
    return withSuffix(base, "." + molType.getDbType().charAt(0) + "al");
  }

  public static boolean isComplete(Path base, MolType molType) {
    return Files.isRegularFile(aliasFile(base, molType))
        || expectedFiles(base, molType).stream().allMatch(Files::isRegularFile);
  }

  public static boolean isAbsent(Path base, MolType molType) {
    return !Files.isRegularFile(aliasFile(base, molType))
        && expectedFiles(base, molType).stream().noneMatch(Files::isRegularFile);
  }

  /**
   * Deletes every known artifact of a database. A missing file is not an error and a file that
   * cannot be deleted is only logged.
   *
   * @return number of files deleted
   */
  public static int deleteArtifacts(Path base, MolType molType) {
    char prefix = molType.getDbType().charAt(0);
    int deleted = 0;
    for (String suffix : ARTIFACT_SUFFIXES) {
      Path file = withSuffix(base, "." + prefix + suffix);
      try {
        if (Files.deleteIfExists(file)) {
          deleted++;
        }
      } catch (IOException e) {
        log.warn("Cannot delete database file {}", file, e);
      }
    }
    return deleted;
  }
}
