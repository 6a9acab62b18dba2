package com.quantori.bqp.executor.ncbi;

import com.quantori.bqp.api.model.SearchRequest;

/** The three calls of the NCBI BLAST URL API. Each returns the response text as is. */
public interface NcbiBlastApi {
  /**
   * Submit a search ({@code CMD=Put}).
   *
   * @param request search to submit, with a cleaned sequence
   * @param database remote database name
   * @return response text containing the request id
   */
  String submit(SearchRequest request, String database);

  /** Status page of a job ({@code FORMAT_OBJECT=SearchInfo}). */
  String poll(String requestId);

  /**
   * Results of a finished job.
   *
   * @param requestId job id
   * @param formatType {@code XML} or {@code Text}
   * @return result document
   */
  String retrieve(String requestId, String formatType);
}
