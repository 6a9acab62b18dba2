package com.quantori.bqp.api.service;

import com.quantori.bqp.api.model.SearchStage;

/** Handle of a running search given to a backend. */
public interface SearchMonitor {
  SearchMonitor NONE =
      new SearchMonitor() {
        @Override
        public boolean isCancelled() {
          return false;
        }

        @Override
        public void progress(SearchStage stage, String message) {}
      };

  /**
   * Whether the caller asked to stop the search. Backends check it where they are about to wait.
   *
   * @return true when the search must stop
   */
  boolean isCancelled();

  void progress(SearchStage stage, String message);
}
