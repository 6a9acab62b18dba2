package com.quantori.bqp.api.service;

import com.quantori.bqp.api.model.DatabaseRecord;
import java.util.List;
import java.util.Optional;

/**
 * Persistent key/value store of database records. Every operation must work on a store that has
 * never been written to.
 */
public interface ConfigStore {
  /**
   * Get a record by an identifier.
   *
   * @param id a record identifier
   * @return the record wrapped in an {@link Optional}
   */
  Optional<DatabaseRecord> get(String id);

  /**
   * Insert or replace a record.
   *
   * @param id a record identifier
   * @param record the record
   */
  void set(String id, DatabaseRecord record);

  /**
   * Remove a record. Removing an absent record does nothing.
   *
   * @param id a record identifier
   */
  void remove(String id);

  /**
   * Get all records.
   *
   * @return all stored records, an empty list on first run
   */
  List<DatabaseRecord> listAll();
}
