package com.quantori.bqp.core.database;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.experimental.UtilityClass;

/** Translation of nucleotide sequences with the standard genetic code. */
@UtilityClass
public class SequenceTranslator {
  public static final int MIN_FRAME_LENGTH = 10;

  private static final String BASES = "TCAG";
  private static final String AMINO_ACIDS =
      "FFLLSSSSYY**CC*WLLLLPPPPHHQQRRRRIIIMTTTTNNKKSSRRVVVVAAAADDEEGGGG";

  public static char translateCodon(CharSequence codon) {
    int index = 0;
    for (int i = 0; i < 3; i++) {
      int base = BASES.indexOf(codon.charAt(i));
      if (base < 0) {
        return 'X';
      }
      index = index * 4 + base;
    }
    return AMINO_ACIDS.charAt(index);
  }

  /** Translates one reading frame starting at {@code offset}; stop codons are left out. */
  public static String translate(String dna, int offset) {
    StringBuilder protein = new StringBuilder(dna.length() / 3);
    for (int i = offset; i + 3 <= dna.length(); i += 3) {
      char aminoAcid = translateCodon(dna.subSequence(i, i + 3));
      if (aminoAcid != '*') {
        protein.append(aminoAcid);
      }
    }
    return protein.toString();
  }

  public static String reverseComplement(String dna) {
    StringBuilder result = new StringBuilder(dna.length());
    for (int i = dna.length() - 1; i >= 0; i--) {
      result.append(complement(dna.charAt(i)));
    }
    return result.toString();
  }

  /**
   * Translates the three forward and three reverse frames. Frames not longer than {@value
   * #MIN_FRAME_LENGTH} residues are dropped.
   *
   * @return frame label ({@code +1..+3}, {@code -1..-3}) to protein sequence
   */
  public static Map<String, String> sixFrames(String dna) {
    String forward = dna.toUpperCase(Locale.ROOT).replaceAll("[^ATGC]", "");
    String reverse = reverseComplement(forward);
    Map<String, String> frames = new LinkedHashMap<>();
    for (int frame = 0; frame < 3; frame++) {
      putFrame(frames, "+" + (frame + 1), translate(forward, frame));
    }
    for (int frame = 0; frame < 3; frame++) {
      putFrame(frames, "-" + (frame + 1), translate(reverse, frame));
    }
    return frames;
  }

  private static void putFrame(Map<String, String> frames, String label, String protein) {
    if (protein.length() > MIN_FRAME_LENGTH) {
      frames.put(label, protein);
    }
  }

  private static char complement(char base) {
    switch (base) {
      case 'A':
        return 'T';
      case 'T':
        return 'A';
      case 'G':
        return 'C';
      case 'C':
        return 'G';
      default:
        return 'N';
    }
  }
}
