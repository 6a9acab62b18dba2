package com.quantori.bqp.api;

import lombok.Getter;

/** The remote service did not accept a job. The full response body is kept as diagnostic. */
@Getter
public class RemoteSubmissionException extends BlastException {
  private final String responseBody;

  public RemoteSubmissionException(String message, String responseBody) {
    super(message);
    this.responseBody = responseBody;
  }

  public RemoteSubmissionException(String message, Throwable cause) {
    super(message, cause);
    this.responseBody = null;
  }
}
