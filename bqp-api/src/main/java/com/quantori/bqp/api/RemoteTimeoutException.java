package com.quantori.bqp.api;

import lombok.Getter;

/** The remote job was still waiting after the attempt ceiling was reached. */
@Getter
public class RemoteTimeoutException extends BlastException {
  private final String requestId;
  private final int attempts;

  public RemoteTimeoutException(String requestId, int attempts) {
    super(
        String.format(
            "BLAST job %s timed out after %d attempts - results may still be processing",
            requestId, attempts));
    this.requestId = requestId;
    this.attempts = attempts;
  }
}
