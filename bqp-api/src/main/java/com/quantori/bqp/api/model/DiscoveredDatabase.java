package com.quantori.bqp.api.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** A database found on disk that the registry did not create. */
@Getter
@Builder
@ToString
public class DiscoveredDatabase {
  private final String basePath;
  private final MolType molType;
}
