package com.quantori.bqp.api.model;

public enum ResultSource {
  LOCAL,
  REMOTE,
  FALLBACK
}
