package com.quantori.bqp.core.database;

import com.quantori.bqp.api.BlastException;
import com.quantori.bqp.api.UnsupportedFormatException;
import com.quantori.bqp.api.model.MolType;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/** Checks that a file looks like FASTA before it is handed to the database builder. */
@Slf4j
@UtilityClass
class FastaFileInspector {
  static final int INSPECTED_LINES = 100;

  private static final Pattern NUCLEOTIDE_LINE =
      Pattern.compile("^[ACGTUNRYSWKMBDHV-]+$", Pattern.CASE_INSENSITIVE);
  private static final Pattern PROTEIN_LINE =
      Pattern.compile("^[A-Z*-]+$", Pattern.CASE_INSENSITIVE);
  private static final Pattern GENBANK_KEYWORDS = Pattern.compile("LOCUS|ACCESSION|VERSION");

  static void check(Path file, MolType molType) {
    if (!Files.isRegularFile(file)) {
      throw new BlastException("Source file not found: " + file);
    }
    Pattern sequenceLine = molType == MolType.PROTEIN ? PROTEIN_LINE : NUCLEOTIDE_LINE;
    boolean headerSeen = false;
    boolean sequenceSeen = false;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      int inspected = 0;
      while ((line = reader.readLine()) != null && inspected < INSPECTED_LINES) {
        line = line.trim();
        if (line.isEmpty()) {
          continue;
        }
        inspected++;
        if (!headerSeen) {
          if (GENBANK_KEYWORDS.matcher(line).find()) {
            throw genBank(file);
          }
          if (!line.startsWith(">")) {
            throw new UnsupportedFormatException(
                "File does not appear to be in FASTA format (first line should start with '>'): "
                    + file);
          }
          headerSeen = true;
        } else if (sequenceLine.matcher(line).matches()) {
          sequenceSeen = true;
        } else if (!line.startsWith(">") && GENBANK_KEYWORDS.matcher(line).find()) {
          throw genBank(file);
        }
      }
    } catch (IOException e) {
      throw new BlastException("Cannot read source file " + file, e);
    }
    if (!headerSeen) {
      throw new UnsupportedFormatException("Source file is empty: " + file);
    }
    if (!sequenceSeen) {
      throw new UnsupportedFormatException(
          String.format(
              "File does not contain valid %s sequence data: %s", molType.getLabel(), file));
    }
    log.debug("{} passed FASTA checks", file);
  }

  private static UnsupportedFormatException genBank(Path file) {
    return new UnsupportedFormatException(
        "File appears to be in GenBank format, not FASTA: " + file);
  }
}
