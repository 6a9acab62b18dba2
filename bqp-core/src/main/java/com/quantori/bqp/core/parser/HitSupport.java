package com.quantori.bqp.core.parser;

import com.quantori.bqp.api.model.Hsp;
import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

/** Field derivations shared by the parsers. */
@UtilityClass
class HitSupport {
  static final Comparator<Hsp> HSP_RANK =
      Comparator.comparingDouble(Hsp::getBitScore).reversed().thenComparingDouble(Hsp::getEvalue);

  private static final Pattern ORGANISM = Pattern.compile("\\[([^\\[\\]]+)]\\s*$");

  /** Organism in a trailing {@code [Genus species]} of a description, or null. */
  static String organism(String description) {
    if (StringUtils.isBlank(description)) {
      return null;
    }
    String firstTitle = StringUtils.substringBefore(description, " >");
    Matcher matcher = ORGANISM.matcher(firstTitle.trim());
    return matcher.find() ? matcher.group(1).trim() : null;
  }

  /** Accession of a sequence id such as {@code gi|123|ref|NM_000546.6|} or {@code lcl|seq1}. */
  static String accession(String sequenceId) {
    String id = StringUtils.strip(sequenceId, "|");
    if (!id.contains("|")) {
      return id;
    }
    String[] parts = id.split("\\|");
    return parts[parts.length - 1].isEmpty() ? parts[parts.length - 2] : parts[parts.length - 1];
  }

  static double percent(double part, double whole) {
    return whole > 0 ? part / whole * 100 : 0;
  }

  /** Share of the query covered by an alignment, capped at 100 for gapped alignments. */
  static double coverage(int alignmentLength, int queryLength) {
    return Math.min(100, percent(alignmentLength, queryLength));
  }
}
