package com.quantori.bqp.api;

/** A session already runs a search; new requests are rejected rather than queued. */
public class SearchInProgressException extends BlastException {
  public SearchInProgressException(String sessionId) {
    super("A BLAST search is already in progress in session " + sessionId);
  }
}
