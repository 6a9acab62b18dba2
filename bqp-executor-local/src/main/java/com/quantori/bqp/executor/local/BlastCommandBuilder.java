package com.quantori.bqp.executor.local;

import com.quantori.bqp.api.model.AdvancedParameters;
import com.quantori.bqp.api.model.BlastProgram;
import com.quantori.bqp.api.model.OutputFormat;
import com.quantori.bqp.api.model.SearchRequest;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/** Assembles the argument list of one search program run. */
@AllArgsConstructor
class BlastCommandBuilder {
  private final LocalBlastProperties properties;

  List<String> build(SearchRequest request, Path queryFile, String databasePath) {
    BlastProgram program = request.getProgram();
    AdvancedParameters advanced =
        request.getAdvanced() == null
            ? AdvancedParameters.builder().build()
            : request.getAdvanced();

    List<String> command = new ArrayList<>();
    command.add(properties.executable(program.getCommand()));
    add(command, "-query", queryFile.toString());
    add(command, "-db", databasePath);
    add(command, "-evalue", Double.toString(request.getEvalueThreshold()));
    add(command, "-max_target_seqs", Integer.toString(request.getMaxTargets()));
    add(command, "-outfmt", "6 " + OutputFormat.TABULAR_COLUMNS);

    switch (program) {
      case BLASTN:
        add(
            command,
            "-word_size",
            Integer.toString(
                advanced.getWordSize() == null
                    ? properties.getDefaultWordSize()
                    : advanced.getWordSize()));
        break;
      case BLASTP:
        add(
            command,
            "-matrix",
            StringUtils.defaultIfBlank(advanced.getMatrix(), properties.getDefaultMatrix()));
        add(
            command,
            "-gapopen",
            Integer.toString(
                advanced.getGapOpen() == null
                    ? properties.getDefaultGapOpen()
                    : advanced.getGapOpen()));
        add(
            command,
            "-gapextend",
            Integer.toString(
                advanced.getGapExtend() == null
                    ? properties.getDefaultGapExtend()
                    : advanced.getGapExtend()));
        break;
      default:
        if (StringUtils.isNotBlank(advanced.getMatrix())) {
          add(command, "-matrix", advanced.getMatrix());
        }
    }
    if (advanced.isLowComplexityFilter()) {
      add(command, "-soft_masking", "true");
    }
    return command;
  }

  private static void add(List<String> command, String option, String value) {
    command.add(option);
    command.add(value);
  }
}
