package com.quantori.bqp.api.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named local search database with its lifecycle state. Records are owned by the database
 * registry, which is the only place that mutates them.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseRecord {
  private String id;
  private String name;
  private String title;
  private MolType molType;
  private DatabaseStatus status;
  private DatabaseOrigin origin;

  /** Directory holding the database files. */
  private String directory;

  /** Base path handed to the search tools, i.e. the file path without extension. */
  private String basePath;

  private long sequenceCount;
  private long letterCount;
  private String sourceFilePath;
  private Instant createdAt;
  private Instant lastValidated;
}
