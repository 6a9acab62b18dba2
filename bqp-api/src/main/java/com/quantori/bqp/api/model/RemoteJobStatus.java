package com.quantori.bqp.api.model;

public enum RemoteJobStatus {
  WAITING,
  READY,
  FAILED,
  UNKNOWN,
  TIMED_OUT;

  public boolean isTerminal() {
    return this != WAITING;
  }
}
