package com.quantori.bqp.core.sequence;

import com.quantori.bqp.api.ValidationException;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.SequenceQuery;
import com.quantori.bqp.api.model.SequenceType;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

/** Cleans and classifies query sequences and checks search requests before execution. */
@UtilityClass
public class SequenceValidator {
  public static final int MIN_SEQUENCE_LENGTH = 10;

  private static final double UNAMBIGUOUS_BASE_RATIO = 0.85;
  private static final Pattern PROTEIN_ONLY_RESIDUES = Pattern.compile("[EFILPQZ]");
  private static final Pattern NUCLEOTIDE_ALPHABET = Pattern.compile("^[ATGCURYSWKMBDHVN]+$");
  private static final Pattern NON_SEQUENCE_CHARS = Pattern.compile("[^A-Z*]");

  /**
   * Removes header lines and every character that is not a residue letter or a stop mark, then
   * upper-cases the rest.
   */
  public static String clean(String raw) {
    if (raw == null) {
      return "";
    }
    StringBuilder body = new StringBuilder(raw.length());
    for (String line : raw.split("\\R")) {
      if (!line.trim().startsWith(">")) {
        body.append(line);
      }
    }
    return NON_SEQUENCE_CHARS.matcher(body.toString().toUpperCase(Locale.ROOT)).replaceAll("");
  }

  public static SequenceType detectType(String sequence) {
    if (StringUtils.isEmpty(sequence)) {
      return SequenceType.UNKNOWN;
    }
    if (PROTEIN_ONLY_RESIDUES.matcher(sequence).find()) {
      return SequenceType.PROTEIN;
    }
    if (!NUCLEOTIDE_ALPHABET.matcher(sequence).matches()) {
      return SequenceType.UNKNOWN;
    }
    long unambiguous = sequence.chars().filter(c -> "ATGC".indexOf(c) >= 0).count();
    return (double) unambiguous / sequence.length() > UNAMBIGUOUS_BASE_RATIO
        ? SequenceType.DNA
        : SequenceType.DNA_AMBIGUOUS;
  }

  public static SequenceQuery validate(String raw) {
    String sequence = clean(raw);
    if (sequence.length() < MIN_SEQUENCE_LENGTH) {
      throw new ValidationException(
          String.format(
              "Query sequence must be at least %d characters long, got %d",
              MIN_SEQUENCE_LENGTH, sequence.length()));
    }
    return SequenceQuery.builder().sequence(sequence).type(detectType(sequence)).build();
  }

  /** Checks everything that can be checked without touching a database or a backend. */
  public static SequenceQuery validate(SearchRequest request) {
    if (request == null) {
      throw new ValidationException("Search request is missing");
    }
    SequenceQuery query = validate(request.getSequence());
    if (request.getProgram() == null) {
      throw new ValidationException("Please select a BLAST program");
    }
    if (request.getService() == null) {
      throw new ValidationException("Please select a search service");
    }
    if (StringUtils.isBlank(request.getDatabase())) {
      throw new ValidationException("Please select a database");
    }
    if (!(request.getEvalueThreshold() > 0)) {
      throw new ValidationException(
          "E-value threshold must be positive, got " + request.getEvalueThreshold());
    }
    if (request.getMaxTargets() <= 0) {
      throw new ValidationException(
          "Maximum number of targets must be positive, got " + request.getMaxTargets());
    }
    if (!request.getProgram().accepts(query.getType())) {
      String program = request.getProgram().getCommand().toUpperCase(Locale.ROOT);
      if (query.getType() == SequenceType.PROTEIN) {
        throw new ValidationException(program + " cannot be used with protein sequences");
      }
      throw new ValidationException(
          program + " requires a protein sequence, got " + query.getType().getLabel());
    }
    return query;
  }
}
