package com.quantori.bqp.core.parser;

import com.quantori.bqp.api.model.BlastProgram;
import com.quantori.bqp.api.model.OutputFormat;

/**
 * Turns the raw output of a search into hits. A parser skips single records it cannot read and
 * fails with {@link com.quantori.bqp.api.ResultParseException} only when nothing could be read.
 */
public interface ResultParser {
  /**
   * The output format this parser reads.
   *
   * @return output format
   */
  OutputFormat format();

  /**
   * Parse raw output.
   *
   * @param body raw output
   * @param queryLength length of the cleaned query, used to derive coverage
   * @param program program that produced the output
   * @return hits in default order with the statistics the output carries
   */
  ParsedOutput parse(String body, int queryLength, BlastProgram program);
}
