package com.quantori.bqp.core.database;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.quantori.bqp.api.BlastException;
import com.quantori.bqp.api.model.DatabaseRecord;
import com.quantori.bqp.api.service.ConfigStore;
import com.quantori.bqp.core.utilities.JsonMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps database records in one JSON array file. The file is read lazily and rewritten as a whole
 * on every change through a temporary file, so a crash never leaves it half written.
 */
@Slf4j
public class JsonFileConfigStore implements ConfigStore {
  private final Path file;
  private Map<String, DatabaseRecord> records;

  public JsonFileConfigStore(Path file) {
    this.file = file;
  }

  @Override
  public synchronized Optional<DatabaseRecord> get(String id) {
    return Optional.ofNullable(records().get(id));
  }

  @Override
  public synchronized void set(String id, DatabaseRecord record) {
    records().put(id, record.toBuilder().build());
    save();
  }

  @Override
  public synchronized void remove(String id) {
    if (records().remove(id) != null) {
      save();
    }
  }

  @Override
  public synchronized List<DatabaseRecord> listAll() {
    return new ArrayList<>(records().values());
  }

  private Map<String, DatabaseRecord> records() {
    if (records == null) {
      records = new LinkedHashMap<>();
      if (Files.isRegularFile(file)) {
        try {
          String json = Files.readString(file, StandardCharsets.UTF_8);
          for (DatabaseRecord record : JsonMapper.toDatabaseRecords(json)) {
            records.put(record.getId(), record);
          }
          log.debug("Loaded {} database records from {}", records.size(), file);
        } catch (IOException e) {
          records = null;
          throw new BlastException("Cannot read database catalog " + file, e);
        }
      }
    }
    return records;
  }

  private void save() {
    try {
      Path directory = file.toAbsolutePath().getParent();
      Files.createDirectories(directory);
      Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
      Files.writeString(
          temp, JsonMapper.toJsonString(new ArrayList<>(records.values())), StandardCharsets.UTF_8);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (JsonProcessingException e) {
      throw new BlastException("Cannot serialize database catalog", e);
    } catch (IOException e) {
      throw new BlastException("Cannot write database catalog " + file, e);
    }
  }
}
