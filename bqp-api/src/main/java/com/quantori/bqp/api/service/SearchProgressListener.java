package com.quantori.bqp.api.service;

import com.quantori.bqp.api.model.SearchStage;

/**
 * Receives notifications of one search as it runs. A listener is passed with every search call;
 * implementations must be thread safe, because notifications come from the thread executing the
 * search.
 */
public interface SearchProgressListener {
  SearchProgressListener NONE = (stage, message) -> {};

  /**
   * Called when the search enters a stage or makes progress inside it.
   *
   * @param stage current stage
   * @param message human readable description
   */
  void onProgress(SearchStage stage, String message);

  /**
   * Called for a condition the user should notice, like results being simulated.
   *
   * @param message human readable description
   */
  default void onWarning(String message) {}
}
