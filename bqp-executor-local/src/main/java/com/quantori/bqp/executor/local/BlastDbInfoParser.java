package com.quantori.bqp.executor.local;

import com.quantori.bqp.api.model.DatabaseInfo;
import com.quantori.bqp.api.model.DiscoveredDatabase;
import com.quantori.bqp.api.model.MolType;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/** Reads the reports of {@code blastdbcmd -info} and {@code blastdbcmd -list}. */
@Slf4j
@UtilityClass
class BlastDbInfoParser {
  private static final Pattern TITLE = Pattern.compile("^Database:\\s*(.+)$", Pattern.MULTILINE);
  private static final Pattern SUMMARY =
      Pattern.compile("([\\d,]+)\\s+sequences;\\s+([\\d,]+)\\s+total\\s+(?:bases|residues)");
  private static final Pattern SEQUENCES = Pattern.compile("Number of sequences:\\s*([\\d,]+)");
  private static final Pattern LETTERS = Pattern.compile("Number of letters:\\s*([\\d,]+)");

  static DatabaseInfo parseInfo(String report) {
    String text = StringUtils.defaultString(report);
    DatabaseInfo.DatabaseInfoBuilder info = DatabaseInfo.builder();
    Matcher title = TITLE.matcher(text);
    if (title.find()) {
      info.title(title.group(1).trim());
    }
    Matcher summary = SUMMARY.matcher(text);
    if (summary.find()) {
      return info.sequenceCount(number(summary.group(1)))
          .letterCount(number(summary.group(2)))
          .build();
    }
    Matcher sequences = SEQUENCES.matcher(text);
    Matcher letters = LETTERS.matcher(text);
    if (sequences.find() && letters.find()) {
      return info.sequenceCount(number(sequences.group(1)))
          .letterCount(number(letters.group(1)))
          .build();
    }
    log.warn("No sequence counts in database report, assuming an empty database");
    return info.build();
  }

  /** Lines of {@code <path> <Nucleotide|Protein>}; the path itself may contain spaces. */
  static List<DiscoveredDatabase> parseList(String report) {
    List<DiscoveredDatabase> databases = new ArrayList<>();
    for (String line : StringUtils.defaultString(report).split("\\R")) {
      String trimmed = line.trim();
      int split = trimmed.lastIndexOf(' ');
      if (split <= 0) {
        continue;
      }
      MolType molType = molType(trimmed.substring(split + 1));
      if (molType == null) {
        log.debug("Skipping database list line: {}", trimmed);
        continue;
      }
      databases.add(
          DiscoveredDatabase.builder()
              .basePath(trimmed.substring(0, split).trim())
              .molType(molType)
              .build());
    }
    return databases;
  }

  private static MolType molType(String label) {
    if ("nucleotide".equalsIgnoreCase(label)) {
      return MolType.NUCLEOTIDE;
    }
    if ("protein".equalsIgnoreCase(label)) {
      return MolType.PROTEIN;
    }
    return null;
  }

  private static long number(String digits) {
    return Long.parseLong(digits.replace(",", ""));
  }
}
