package com.quantori.bqp.api;

/** The caller stopped a search before it completed. */
public class SearchCancelledException extends BlastException {
  public SearchCancelledException(String message) {
    super(message);
  }
}
