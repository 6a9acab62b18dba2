package com.quantori.bqp.api.model;

public enum DatabaseStatus {
  CREATING,
  READY,
  ERROR
}
