package com.quantori.bqp.api.model;

import java.util.Locale;

public enum ServiceType {
  LOCAL,
  REMOTE;

  public static ServiceType fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
