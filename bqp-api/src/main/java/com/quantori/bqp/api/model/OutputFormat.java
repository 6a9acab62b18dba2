package com.quantori.bqp.api.model;

public enum OutputFormat {
  TABULAR,
  XML;

  /** Column list requested from local runs and expected by the tabular reader. */
  public static final String TABULAR_COLUMNS =
      "qseqid sseqid pident length mismatch gapopen qstart qend sstart send evalue bitscore"
          + " stitle qseq sseq qcovs qcovhsp";
}
