package com.quantori.bqp.core.parser;

import com.quantori.bqp.api.ResultParseException;
import com.quantori.bqp.api.model.Alignment;
import com.quantori.bqp.api.model.BlastProgram;
import com.quantori.bqp.api.model.Hit;
import com.quantori.bqp.api.model.Hsp;
import com.quantori.bqp.api.model.OutputFormat;
import com.quantori.bqp.api.model.Range;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads tab separated output with the columns {@code qseqid sseqid pident length mismatch gapopen
 * qstart qend sstart send evalue bitscore}, optionally followed by {@code stitle qseq sseq qcovs
 * qcovhsp}. Rows of the same subject are merged into one hit.
 */
@Slf4j
public class TabularResultParser implements ResultParser {
  public static final String OUTPUT_COLUMNS = OutputFormat.TABULAR_COLUMNS;
  static final int REQUIRED_COLUMNS = 12;

  private static final int SUBJECT_ID = 1;
  private static final int PERCENT_IDENTITY = 2;
  private static final int LENGTH = 3;
  private static final int MISMATCHES = 4;
  private static final int GAP_OPENINGS = 5;
  private static final int QUERY_START = 6;
  private static final int QUERY_END = 7;
  private static final int SUBJECT_START = 8;
  private static final int SUBJECT_END = 9;
  private static final int EVALUE = 10;
  private static final int BIT_SCORE = 11;
  private static final int TITLE = 12;
  private static final int QUERY_SEQUENCE = 13;
  private static final int SUBJECT_SEQUENCE = 14;
  private static final int HSP_COVERAGE = 16;

  @Override
  public OutputFormat format() {
    return OutputFormat.TABULAR;
  }

  @Override
  public ParsedOutput parse(String body, int queryLength, BlastProgram program) {
    Map<String, List<Hsp>> hspsBySubject = new LinkedHashMap<>();
    Map<String, String> titles = new LinkedHashMap<>();
    int dataLines = 0;
    int rejected = 0;
    for (String line : StringUtils.defaultString(body).split("\\R")) {
      if (StringUtils.isBlank(line) || line.startsWith("#")) {
        continue;
      }
      dataLines++;
      String[] columns = line.split("\t", -1);
      if (columns.length < REQUIRED_COLUMNS) {
        log.debug("Skipping line with {} columns: {}", columns.length, line);
        rejected++;
        continue;
      }
      try {
        Hsp hsp = toHsp(columns, queryLength, program.isProteinScoring());
        String accession = HitSupport.accession(columns[SUBJECT_ID].trim());
        hspsBySubject.computeIfAbsent(accession, key -> new ArrayList<>()).add(hsp);
        titles.putIfAbsent(accession, column(columns, TITLE));
      } catch (NumberFormatException e) {
        log.debug("Skipping line with unreadable numbers: {}", line);
        rejected++;
      }
    }
    if (dataLines > 0 && rejected == dataLines) {
      throw new ResultParseException(
          String.format("None of %d tabular result lines could be parsed", dataLines));
    }
    if (rejected > 0) {
      log.warn("Skipped {} of {} malformed tabular result lines", rejected, dataLines);
    }
    List<Hit> hits =
        hspsBySubject.entrySet().stream()
            .map(entry -> toHit(entry.getKey(), titles.get(entry.getKey()), entry.getValue()))
            .sorted(HitOrdering.DEFAULT)
            .collect(Collectors.toList());
    return ParsedOutput.builder().hits(hits).rejectedLines(rejected).build();
  }

  private static Hsp toHsp(String[] columns, int queryLength, boolean protein) {
    double percentIdentity = Double.parseDouble(columns[PERCENT_IDENTITY].trim());
    int length = Integer.parseInt(columns[LENGTH].trim());
    int identities = (int) Math.round(length * percentIdentity / 100);
    String querySequence = StringUtils.defaultString(column(columns, QUERY_SEQUENCE));
    String subjectSequence = StringUtils.defaultString(column(columns, SUBJECT_SEQUENCE));

    Alignment alignment = Alignment.EMPTY;
    int gaps = Integer.parseInt(columns[GAP_OPENINGS].trim());
    int positives = identities;
    if (!querySequence.isEmpty() && querySequence.length() == subjectSequence.length()) {
      String matchLine = MatchLineBuilder.build(querySequence, subjectSequence, protein);
      alignment = new Alignment(querySequence, subjectSequence, matchLine);
      gaps = MatchLineBuilder.countGaps(querySequence, subjectSequence);
      positives =
          MatchLineBuilder.count(matchLine, MatchLineBuilder.IDENTICAL)
              + MatchLineBuilder.count(matchLine, MatchLineBuilder.SIMILAR);
    }

    String hspCoverage = column(columns, HSP_COVERAGE);
    double coverage =
        StringUtils.isNotBlank(hspCoverage)
            ? Double.parseDouble(hspCoverage.trim())
            : HitSupport.coverage(length, queryLength);

    return Hsp.builder()
        .bitScore(Double.parseDouble(columns[BIT_SCORE].trim()))
        .evalue(Double.parseDouble(columns[EVALUE].trim()))
        .identityCount(Math.min(identities, length))
        .positiveCount(Math.min(positives, length))
        .identityPercent(percentIdentity)
        .alignmentLength(length)
        .mismatchCount(Integer.parseInt(columns[MISMATCHES].trim()))
        .gapCount(gaps)
        .coveragePercent(coverage)
        .queryRange(
            Range.of(
                Integer.parseInt(columns[QUERY_START].trim()),
                Integer.parseInt(columns[QUERY_END].trim())))
        .hitRange(
            Range.of(
                Integer.parseInt(columns[SUBJECT_START].trim()),
                Integer.parseInt(columns[SUBJECT_END].trim())))
        .alignment(alignment)
        .build();
  }

  private static Hit toHit(String accession, String title, List<Hsp> hsps) {
    hsps.sort(HitSupport.HSP_RANK);
    String description = StringUtils.defaultIfBlank(title, accession);
    return Hit.fromPrimary(hsps.get(0))
        .accession(accession)
        .description(description)
        .organism(HitSupport.organism(description))
        .hsps(List.copyOf(hsps))
        .build();
  }

  private static String column(String[] columns, int index) {
    return index < columns.length ? columns[index] : null;
  }
}
