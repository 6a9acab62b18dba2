package com.quantori.bqp.core.source;

import com.quantori.bqp.api.model.SearchStage;
import com.quantori.bqp.api.service.SearchMonitor;
import com.quantori.bqp.api.service.SearchProgressListener;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/** Cancellation flag of one search that forwards progress to the caller's listener. */
@Slf4j
class ListenerSearchMonitor implements SearchMonitor {
  private final String searchId;
  private final SearchProgressListener listener;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  ListenerSearchMonitor(String searchId, SearchProgressListener listener) {
    this.searchId = searchId;
    this.listener = listener == null ? SearchProgressListener.NONE : listener;
  }

  void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      log.info("Search {} cancelled", searchId);
    }
  }

  @Override
  public boolean isCancelled() {
    return cancelled.get();
  }

  @Override
  public void progress(SearchStage stage, String message) {
    log.debug("Search {} [{}] {}", searchId, stage, message);
    try {
      listener.onProgress(stage, message);
    } catch (RuntimeException e) {
      log.warn("Progress listener of search {} failed", searchId, e);
    }
  }

  void warning(String message) {
    try {
      listener.onWarning(message);
    } catch (RuntimeException e) {
      log.warn("Progress listener of search {} failed", searchId, e);
    }
  }
}
