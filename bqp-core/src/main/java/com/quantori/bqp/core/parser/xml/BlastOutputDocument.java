package com.quantori.bqp.core.parser.xml;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Binding of the NCBI {@code BlastOutput} XML document. Only the fields in use are mapped. */
@Data
@NoArgsConstructor
@JacksonXmlRootElement(localName = "BlastOutput")
public class BlastOutputDocument {
  @JacksonXmlProperty(localName = "BlastOutput_program")
  private String program;

  @JacksonXmlProperty(localName = "BlastOutput_db")
  private String database;

  @JacksonXmlProperty(localName = "BlastOutput_query-len")
  private Integer queryLength;

  @JacksonXmlElementWrapper(localName = "BlastOutput_iterations")
  @JacksonXmlProperty(localName = "Iteration")
  private List<Iteration> iterations;

  @Data
  @NoArgsConstructor
  public static class Iteration {
    @JacksonXmlProperty(localName = "Iteration_iter-num")
    private Integer number;

    @JacksonXmlProperty(localName = "Iteration_query-len")
    private Integer queryLength;

    @JacksonXmlElementWrapper(localName = "Iteration_hits")
    @JacksonXmlProperty(localName = "Hit")
    private List<HitElement> hits;

    @JacksonXmlProperty(localName = "Iteration_stat")
    private IterationStat stat;

    @JacksonXmlProperty(localName = "Iteration_message")
    private String message;
  }

  @Data
  @NoArgsConstructor
  public static class IterationStat {
    @JacksonXmlProperty(localName = "Statistics")
    private StatisticsElement statistics;
  }

  @Data
  @NoArgsConstructor
  public static class StatisticsElement {
    @JacksonXmlProperty(localName = "Statistics_db-num")
    private Long databaseSequences;

    @JacksonXmlProperty(localName = "Statistics_db-len")
    private Long databaseLetters;

    @JacksonXmlProperty(localName = "Statistics_eff-space")
    private Double effectiveSearchSpace;

    @JacksonXmlProperty(localName = "Statistics_kappa")
    private Double kappa;

    @JacksonXmlProperty(localName = "Statistics_lambda")
    private Double lambda;

    @JacksonXmlProperty(localName = "Statistics_entropy")
    private Double entropy;
  }

  @Data
  @NoArgsConstructor
  public static class HitElement {
    @JacksonXmlProperty(localName = "Hit_num")
    private Integer number;

    @JacksonXmlProperty(localName = "Hit_id")
    private String id;

    @JacksonXmlProperty(localName = "Hit_def")
    private String definition;

    @JacksonXmlProperty(localName = "Hit_accession")
    private String accession;

    @JacksonXmlProperty(localName = "Hit_len")
    private Integer length;

    @JacksonXmlElementWrapper(localName = "Hit_hsps")
    @JacksonXmlProperty(localName = "Hsp")
    private List<HspElement> hsps;
  }

  @Data
  @NoArgsConstructor
  public static class HspElement {
    @JacksonXmlProperty(localName = "Hsp_num")
    private Integer number;

    @JacksonXmlProperty(localName = "Hsp_bit-score")
    private Double bitScore;

    @JacksonXmlProperty(localName = "Hsp_score")
    private Double score;

    @JacksonXmlProperty(localName = "Hsp_evalue")
    private Double evalue;

    @JacksonXmlProperty(localName = "Hsp_query-from")
    private Integer queryFrom;

    @JacksonXmlProperty(localName = "Hsp_query-to")
    private Integer queryTo;

    @JacksonXmlProperty(localName = "Hsp_hit-from")
    private Integer hitFrom;

    @JacksonXmlProperty(localName = "Hsp_hit-to")
    private Integer hitTo;

    @JacksonXmlProperty(localName = "Hsp_identity")
    private Integer identity;

    @JacksonXmlProperty(localName = "Hsp_positive")
    private Integer positive;

    @JacksonXmlProperty(localName = "Hsp_gaps")
    private Integer gaps;

    @JacksonXmlProperty(localName = "Hsp_align-len")
    private Integer alignLength;

    @JacksonXmlProperty(localName = "Hsp_qseq")
    private String querySequence;

    @JacksonXmlProperty(localName = "Hsp_hseq")
    private String hitSequence;

    @JacksonXmlProperty(localName = "Hsp_midline")
    private String midline;
  }
}
