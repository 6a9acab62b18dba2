package com.quantori.bqp.core.database;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.bqp.api.BlastException;
import com.quantori.bqp.api.model.DatabaseOrigin;
import com.quantori.bqp.api.model.DatabaseRecord;
import com.quantori.bqp.api.model.DatabaseStatus;
import com.quantori.bqp.api.model.MolType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileConfigStoreTest {

  @TempDir Path directory;

  @Test
  void recordsSurviveReopening() {
    Path file = directory.resolve("catalog").resolve("databases.json");
    JsonFileConfigStore store = new JsonFileConfigStore(file);
    DatabaseRecord record = record("db_1", "ecoli");
    store.set(record.getId(), record);
    store.set("db_2", record("db_2", "human"));

    assertTrue(Files.isRegularFile(file));
    JsonFileConfigStore reopened = new JsonFileConfigStore(file);
    assertEquals(record, reopened.get("db_1").orElseThrow());
    assertThat(
        reopened.listAll().stream().map(DatabaseRecord::getName).collect(Collectors.toList()),
        contains("ecoli", "human"));
  }

  @Test
  void removeDeletesRecord() {
    Path file = directory.resolve("databases.json");
    JsonFileConfigStore store = new JsonFileConfigStore(file);
    store.set("db_1", record("db_1", "ecoli"));
    store.remove("db_1");
    store.remove("unknown");

    assertFalse(new JsonFileConfigStore(file).get("db_1").isPresent());
    assertThat(new JsonFileConfigStore(file).listAll(), empty());
  }

  @Test
  void storedRecordIsACopy() {
    JsonFileConfigStore store = new JsonFileConfigStore(directory.resolve("databases.json"));
    DatabaseRecord record = record("db_1", "ecoli");
    store.set("db_1", record);
    record.setStatus(DatabaseStatus.ERROR);

    assertEquals(DatabaseStatus.READY, store.get("db_1").orElseThrow().getStatus());
  }

  @Test
  void missingFileIsAnEmptyCatalog() {
    assertThat(new JsonFileConfigStore(directory.resolve("none.json")).listAll(), empty());
  }

  @Test
  void unreadableCatalogFails() throws IOException {
    Path file = Files.writeString(directory.resolve("databases.json"), "{not json");
    BlastException e =
        assertThrows(BlastException.class, () -> new JsonFileConfigStore(file).listAll());
    assertThat(e.getMessage(), containsString("Cannot read database catalog"));
  }

  private static DatabaseRecord record(String id, String name) {
    return DatabaseRecord.builder()
        .id(id)
        .name(name)
        .title(name)
        .molType(MolType.NUCLEOTIDE)
        .status(DatabaseStatus.READY)
        .origin(DatabaseOrigin.CUSTOM)
        .directory("/data/blast")
        .basePath("/data/blast/" + id)
        .sequenceCount(2)
        .letterCount(120)
        .createdAt(Instant.parse("2024-03-01T10:15:30Z"))
        .build();
  }
}
