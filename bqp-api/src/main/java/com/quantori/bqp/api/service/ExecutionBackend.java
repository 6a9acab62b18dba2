package com.quantori.bqp.api.service;

import com.quantori.bqp.api.model.RawOutput;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.ServiceType;

/**
 * A backend runs one search and returns its unparsed output. There is one backend per {@link
 * ServiceType}; the orchestrator picks it once, by the request's service, and never branches on the
 * service afterwards.
 *
 * <p>Errors are reported with the platform exceptions: a failed subprocess as {@link
 * com.quantori.bqp.api.ProcessExecutionException}, a failed remote job as one of the remote
 * exceptions, a stop requested by the caller as {@link
 * com.quantori.bqp.api.SearchCancelledException}.
 */
public interface ExecutionBackend {
  /**
   * The service this backend implements.
   *
   * @return service type
   */
  ServiceType service();

  /**
   * Execute a search.
   *
   * @param request a validated request; its sequence is already cleaned
   * @param databasePath resolved database path for local searches, remote database name otherwise
   * @param monitor cancellation flag and progress sink of the running search
   * @return raw output of the search
   */
  RawOutput execute(SearchRequest request, String databasePath, SearchMonitor monitor);
}
