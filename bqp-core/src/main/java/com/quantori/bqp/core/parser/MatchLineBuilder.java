package com.quantori.bqp.core.parser;

import java.util.List;
import lombok.experimental.UtilityClass;

/** Builds the middle line of a pairwise alignment from the aligned strands. */
@UtilityClass
public class MatchLineBuilder {
  public static final char IDENTICAL = '|';
  public static final char SIMILAR = '+';
  public static final char BLANK = ' ';

  private static final List<String> SIMILARITY_GROUPS =
      List.of("AG", "ILV", "FWY", "KR", "DE", "QN", "ST", "CM");

  /**
   * Compares the strands position by position. Strands of different length cannot be aligned and
   * give an empty line.
   *
   * @param protein whether residues of the same similarity group are marked as similar
   */
  public static String build(String query, String subject, boolean protein) {
    if (query == null || subject == null || query.length() != subject.length()) {
      return "";
    }
    StringBuilder line = new StringBuilder(query.length());
    for (int i = 0; i < query.length(); i++) {
      line.append(mark(query.charAt(i), subject.charAt(i), protein));
    }
    return line.toString();
  }

  static char mark(char query, char subject, boolean protein) {
    char q = Character.toUpperCase(query);
    char s = Character.toUpperCase(subject);
    if (q == '-' || s == '-') {
      return BLANK;
    }
    if (q == s) {
      return IDENTICAL;
    }
    if (protein && similar(q, s)) {
      return SIMILAR;
    }
    return BLANK;
  }

  static boolean similar(char a, char b) {
    for (String group : SIMILARITY_GROUPS) {
      if (group.indexOf(a) >= 0 && group.indexOf(b) >= 0) {
        return true;
      }
    }
    return false;
  }

  static int count(String matchLine, char mark) {
    int count = 0;
    for (int i = 0; i < matchLine.length(); i++) {
      if (matchLine.charAt(i) == mark) {
        count++;
      }
    }
    return count;
  }

  static int countGaps(String query, String subject) {
    return count(query, '-') + count(subject, '-');
  }
}
