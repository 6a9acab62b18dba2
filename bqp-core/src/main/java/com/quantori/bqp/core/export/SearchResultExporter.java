package com.quantori.bqp.core.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.quantori.bqp.api.BlastException;
import com.quantori.bqp.api.model.AdvancedParameters;
import com.quantori.bqp.api.model.Hit;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.SearchResult;
import com.quantori.bqp.api.model.Statistics;
import com.quantori.bqp.core.utilities.JsonMapper;
import java.util.Locale;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

/** Renders search results for files and terminals. */
@UtilityClass
public class SearchResultExporter {
  public static final String SIMULATED_MARKER = "*** SIMULATED RESULTS ***";

  static final String HIT_HEADER =
      String.join(
          "\t",
          "#",
          "accession",
          "description",
          "organism",
          "evalue",
          "bit_score",
          "identity_pct",
          "coverage_pct",
          "align_len",
          "mismatches",
          "gaps",
          "q_start",
          "q_end",
          "s_start",
          "s_end");

  public static String toText(SearchResult result) {
    StringBuilder out = new StringBuilder();
    out.append("BLAST search ").append(result.getSearchId()).append('\n');
    out.append("Source: ").append(result.getSource());
    out.append(result.isRealResults() ? " (real results)" : " (simulated results)").append('\n');
    if (!result.isRealResults()) {
      out.append(SIMULATED_MARKER).append('\n');
      out.append("These are simulated results. Original error: ")
          .append(StringUtils.defaultString(result.getErrorMessage()))
          .append('\n');
    }
    if (result.getRemoteJobId() != null) {
      out.append("Remote job: ").append(result.getRemoteJobId()).append('\n');
    }
    if (result.getCompletedAt() != null) {
      out.append("Completed: ").append(result.getCompletedAt()).append('\n');
    }
    out.append('\n');

    if (result.getQueryInfo() != null) {
      out.append("Query: ")
          .append(result.getQueryInfo().getLength())
          .append(" letters, ")
          .append(result.getQueryInfo().getType().getLabel())
          .append('\n');
      out.append("  ").append(result.getQueryInfo().getPreview()).append('\n');
    }
    appendParameters(out, result.getParameters());
    appendStatistics(out, result.getStatistics());
    out.append('\n');

    out.append(HIT_HEADER).append('\n');
    int rank = 1;
    for (Hit hit : result.getHits()) {
      out.append(hitRow(rank++, hit)).append('\n');
    }
    if (result.getHits().isEmpty()) {
      out.append("No hits found\n");
    }
    return out.toString();
  }

  public static String toJson(SearchResult result) {
    try {
      return JsonMapper.toJsonString(result);
    } catch (JsonProcessingException e) {
      throw new BlastException("Cannot serialize search result " + result.getSearchId(), e);
    }
  }

  static String hitRow(int rank, Hit hit) {
    return String.join(
        "\t",
        String.valueOf(rank),
        hit.getAccession(),
        StringUtils.defaultString(hit.getDescription()).replace('\t', ' '),
        StringUtils.defaultString(hit.getOrganism()),
        formatEvalue(hit.getEvalue()),
        String.format(Locale.ROOT, "%.1f", hit.getBitScore()),
        String.format(Locale.ROOT, "%.1f", hit.getIdentityPercent()),
        String.format(Locale.ROOT, "%.1f", hit.getCoveragePercent()),
        String.valueOf(hit.getAlignmentLength()),
        String.valueOf(hit.getMismatchCount()),
        String.valueOf(hit.getGapCount()),
        String.valueOf(hit.getQueryRange().getFrom()),
        String.valueOf(hit.getQueryRange().getTo()),
        String.valueOf(hit.getHitRange().getFrom()),
        String.valueOf(hit.getHitRange().getTo()));
  }

  static String formatEvalue(double evalue) {
    if (evalue == 0 || evalue < 1e-100) {
      return "0.0";
    }
    if (evalue < 0.01) {
      return String.format(Locale.ROOT, "%.1e", evalue);
    }
    return String.format(Locale.ROOT, "%.2f", evalue);
  }

  private static void appendParameters(StringBuilder out, SearchRequest request) {
    if (request == null) {
      return;
    }
    out.append("Program: ").append(request.getProgram().getCommand()).append('\n');
    out.append("Service: ").append(request.getService()).append('\n');
    out.append("Database: ").append(request.getDatabase()).append('\n');
    out.append("E-value threshold: ").append(request.getEvalueThreshold()).append('\n');
    out.append("Max targets: ").append(request.getMaxTargets()).append('\n');
    AdvancedParameters advanced = request.getAdvanced();
    if (advanced != null) {
      if (advanced.getWordSize() != null) {
        out.append("Word size: ").append(advanced.getWordSize()).append('\n');
      }
      if (advanced.getMatrix() != null) {
        out.append("Matrix: ").append(advanced.getMatrix()).append('\n');
      }
      if (advanced.getGapOpen() != null && advanced.getGapExtend() != null) {
        out.append("Gap costs: ")
            .append(advanced.getGapOpen())
            .append(' ')
            .append(advanced.getGapExtend())
            .append('\n');
      }
      out.append("Low complexity filter: ").append(advanced.isLowComplexityFilter()).append('\n');
    }
  }

  private static void appendStatistics(StringBuilder out, Statistics statistics) {
    if (statistics == null) {
      return;
    }
    out.append("Database sequences: ").append(statistics.getSequenceCount()).append('\n');
    out.append("Database letters: ").append(statistics.getLetterCount()).append('\n');
    out.append("Search time: ").append(statistics.getSearchTimeMillis()).append(" ms\n");
    if (statistics.getLambda() > 0) {
      out.append(
          String.format(
              Locale.ROOT,
              "Lambda %.3f, K %.3f, H %.3f, effective search space %.0f%n",
              statistics.getLambda(),
              statistics.getKappa(),
              statistics.getEntropy(),
              statistics.getEffectiveSearchSpace()));
    }
  }
}
