package com.quantori.bqp.core.database;

import com.quantori.bqp.api.model.DatabaseRecord;
import com.quantori.bqp.api.service.ConfigStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryConfigStore implements ConfigStore {
  private final Map<String, DatabaseRecord> records = new ConcurrentHashMap<>();

  @Override
  public Optional<DatabaseRecord> get(String id) {
    return Optional.ofNullable(records.get(id));
  }

  @Override
  public void set(String id, DatabaseRecord record) {
    records.put(id, record.toBuilder().build());
  }

  @Override
  public void remove(String id) {
    records.remove(id);
  }

  @Override
  public List<DatabaseRecord> listAll() {
    return new ArrayList<>(records.values());
  }
}
