package com.quantori.bqp.api.service;

import com.quantori.bqp.api.model.DatabaseInfo;
import com.quantori.bqp.api.model.DiscoveredDatabase;
import com.quantori.bqp.api.model.MolType;
import java.nio.file.Path;
import java.util.List;

/** Builds and inspects on-disk search databases. */
public interface DatabaseBuilder {
  /**
   * Build a database from a FASTA file.
   *
   * @param sourceFile FASTA source
   * @param outputBase base path of the files to produce
   * @param title database title
   * @param molType molecule class of the sequences
   * @throws com.quantori.bqp.api.ProcessExecutionException if the builder fails
   */
  void build(Path sourceFile, Path outputBase, String title, MolType molType);

  /**
   * Query the sequence and letter counts of a built database.
   *
   * @param base base path of the database
   * @return database counts
   */
  DatabaseInfo info(Path base);

  /**
   * List the databases found in a directory.
   *
   * @param directory directory to scan
   * @return databases found, an empty list when there are none
   */
  List<DiscoveredDatabase> list(Path directory);
}
