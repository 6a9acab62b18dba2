package com.quantori.bqp.core.source;

import com.quantori.bqp.api.model.DatabaseRecord;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.SequenceQuery;
import com.quantori.bqp.api.service.ExecutionBackend;
import lombok.Builder;
import lombok.Getter;

/** A request that passed every check made before execution. */
@Getter
@Builder
class PreparedSearch {
  private final String searchId;
  private final SearchRequest request;
  private final SequenceQuery query;
  private final ExecutionBackend backend;
  private final String databasePath;

  /** Catalog record of a local database, null for remote searches and unregistered paths. */
  private final DatabaseRecord database;
}
