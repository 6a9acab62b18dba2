package com.quantori.bqp.api;

import com.quantori.bqp.api.model.RemoteJobStatus;
import lombok.Getter;

/** A submitted remote job reached a terminal failure state. Never retried. */
@Getter
public class RemoteJobFailedException extends BlastException {
  private final String requestId;
  private final RemoteJobStatus status;

  public RemoteJobFailedException(String requestId, RemoteJobStatus status, String message) {
    super(message);
    this.requestId = requestId;
    this.status = status;
  }

  public RemoteJobFailedException(
      String requestId, RemoteJobStatus status, String message, Throwable cause) {
    super(message, cause);
    this.requestId = requestId;
    this.status = status;
  }
}
