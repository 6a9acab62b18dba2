package com.quantori.bqp.api.service;

/** Source of reference genome regions. */
public interface GenomeSequenceSource {
  /**
   * Get a region of a chromosome.
   *
   * @param chromosome chromosome name, e.g. {@code chr7}
   * @param start first position, one-based
   * @param end last position, inclusive
   * @return nucleotide sequence of the region
   */
  String getSequence(String chromosome, long start, long end);
}
