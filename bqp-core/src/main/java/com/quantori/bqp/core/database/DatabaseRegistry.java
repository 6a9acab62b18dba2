package com.quantori.bqp.core.database;

import com.quantori.bqp.api.BlastException;
import com.quantori.bqp.api.DatabaseAlreadyExistsException;
import com.quantori.bqp.api.DatabaseNotFoundException;
import com.quantori.bqp.api.ValidationException;
import com.quantori.bqp.api.model.DatabaseInfo;
import com.quantori.bqp.api.model.DatabaseOrigin;
import com.quantori.bqp.api.model.DatabaseRecord;
import com.quantori.bqp.api.model.DatabaseStatus;
import com.quantori.bqp.api.model.DiscoveredDatabase;
import com.quantori.bqp.api.model.MolType;
import com.quantori.bqp.api.service.ConfigStore;
import com.quantori.bqp.api.service.DatabaseBuilder;
import com.quantori.bqp.api.service.GenomeSequenceSource;
import com.quantori.bqp.api.util.DatabaseFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Catalog of the local search databases. Custom databases are built from FASTA files and persisted
 * through a {@link ConfigStore}; discovered databases are found in the database directory and kept
 * in memory only.
 *
 * <p>Mutations of one database are serialized; different databases are changed concurrently. A
 * database that is still being built can be neither deleted nor updated.
 */
@Slf4j
public class DatabaseRegistry {
  static final String CUSTOM_PREFIX = "custom_";
  static final String DISCOVERED_PREFIX = "discovered_";
  private static final int FASTA_LINE_WIDTH = 80;

  private final ConfigStore store;
  private final DatabaseBuilder builder;
  private final Path databaseDirectory;
  private final GenomeSequenceSource genomeSource;
  private final Clock clock;
  private final Map<String, DatabaseRecord> records = new ConcurrentHashMap<>();
  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
  private final Object catalogLock = new Object();

  public DatabaseRegistry(ConfigStore store, DatabaseBuilder builder, Path databaseDirectory) {
    this(store, builder, databaseDirectory, null, Clock.systemUTC());
  }

  public DatabaseRegistry(
      ConfigStore store,
      DatabaseBuilder builder,
      Path databaseDirectory,
      GenomeSequenceSource genomeSource,
      Clock clock) {
    this.store = store;
    this.builder = builder;
    this.databaseDirectory = databaseDirectory;
    this.genomeSource = genomeSource;
    this.clock = clock;
  }

  /**
   * Reads the persisted catalog and validates every custom database once. Records whose files are
   * gone are dropped from the store.
   *
   * @param discover whether to also list the databases of the database directory
   */
  public void load(boolean discover) {
    List<DatabaseRecord> stored = store.listAll();
    synchronized (catalogLock) {
      records.clear();
      stored.forEach(record -> records.put(record.getId(), record));
    }
    int removed = 0;
    for (DatabaseRecord record : stored) {
      if (record.getStatus() == DatabaseStatus.CREATING) {
        // a build interrupted by a crash never finishes
        log.warn("Dropping database {} left in creating state", record.getId());
        forget(record.getId());
        removed++;
      } else if (!validate(record.getId()) && !records.containsKey(record.getId())) {
        removed++;
      }
    }
    log.info("Loaded {} custom databases, removed {} with missing files", records.size(), removed);
    if (discover) {
      discover();
    }
  }

  public DatabaseRecord create(Path sourceFile, String name, MolType molType) {
    if (StringUtils.isBlank(name)) {
      throw new ValidationException("Please enter a database name");
    }
    if (molType == null) {
      throw new ValidationException("Please select a molecule type");
    }
    if (findByName(name).isPresent()) {
      throw new DatabaseAlreadyExistsException(name);
    }
    FastaFileInspector.check(sourceFile, molType);

    Path source = sourceFile.toAbsolutePath();
    DatabaseRecord creating;
    synchronized (catalogLock) {
      if (findByName(name).isPresent()) {
        throw new DatabaseAlreadyExistsException(name);
      }
      String id = newId(name);
      Path base = source.getParent().resolve(id);
      creating =
          DatabaseRecord.builder()
              .id(id)
              .name(name)
              .title(name)
              .molType(molType)
              .status(DatabaseStatus.CREATING)
              .origin(DatabaseOrigin.CUSTOM)
              .directory(base.getParent().toString())
              .basePath(base.toString())
              .sourceFilePath(source.toString())
              .createdAt(clock.instant())
              .build();
      records.put(id, creating);
    }
    return withLock(
        creating.getId(),
        () -> {
          try {
            store.set(creating.getId(), creating);
            log.info("Creating {} database {} from {}", molType.getLabel(), name, source);
            DatabaseRecord ready = build(creating);
            log.info(
                "Database {} is ready: {} sequences, {} letters",
                name,
                ready.getSequenceCount(),
                ready.getLetterCount());
            return ready;
          } catch (RuntimeException e) {
            log.error("Failed to create database {}", name, e);
            DatabaseFiles.deleteArtifacts(Path.of(creating.getBasePath()), molType);
            forget(creating.getId());
            throw e;
          }
        });
  }

  /**
   * Builds a database from a region of the reference genome. Protein databases get the six-frame
   * translation of the region. The FASTA file is kept in the database directory so that the
   * database can be rebuilt later.
   */
  public DatabaseRecord createFromGenome(
      String chromosome, long start, long end, String name, MolType molType) {
    if (genomeSource == null) {
      throw new IllegalStateException("No genome sequence source is configured");
    }
    if (start < 1 || end < start) {
      throw new ValidationException(
          String.format("Invalid genome region %s:%d-%d", chromosome, start, end));
    }
    String region = chromosome + ":" + start + "-" + end;
    String dna =
        StringUtils.defaultString(genomeSource.getSequence(chromosome, start, end))
            .toUpperCase(Locale.ROOT)
            .replaceAll("[^A-Z]", "");
    if (dna.isEmpty()) {
      throw new ValidationException("Could not retrieve sequence data for " + region);
    }
    StringBuilder fasta = new StringBuilder();
    if (molType == MolType.PROTEIN) {
      SequenceTranslator.sixFrames(dna)
          .forEach(
              (frame, protein) ->
                  appendFasta(
                      fasta, chromosome + "_" + start + "_" + end + "_frame_" + frame, protein));
      if (fasta.length() == 0) {
        throw new ValidationException("No reading frame of " + region + " is long enough");
      }
    } else {
      appendFasta(fasta, chromosome + "_" + start + "_" + end, dna);
    }

    Path file = databaseDirectory.resolve(sanitize(name) + "_" + molType.getDbType() + ".fasta");
    try {
      Files.createDirectories(databaseDirectory);
      Files.writeString(file, fasta, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new BlastException("Cannot write genome region to " + file, e);
    }
    log.debug("Wrote {} to {}", region, file);
    try {
      return create(file, name, molType);
    } catch (RuntimeException e) {
      deleteQuietly(file);
      throw e;
    }
  }

  public void delete(String id) {
    checkNotCreating(require(id), "deleted");
    withLock(
        id,
        () -> {
          DatabaseRecord record = require(id);
          checkNotCreating(record, "deleted");
          if (record.getOrigin() != DatabaseOrigin.DISCOVERED) {
            int deleted =
                DatabaseFiles.deleteArtifacts(Path.of(record.getBasePath()), record.getMolType());
            log.debug("Deleted {} files of database {}", deleted, id);
          }
          forget(id);
          log.info("Database {} ({}) deleted", record.getName(), id);
          return null;
        });
    locks.remove(id);
  }

  /** Rebuilds a custom database from its original source file. Id and name are kept. */
  public DatabaseRecord update(String id) {
    checkNotCreating(require(id), "updated");
    return withLock(
        id,
        () -> {
          DatabaseRecord record = require(id);
          checkNotCreating(record, "updated");
          if (record.getOrigin() == DatabaseOrigin.DISCOVERED) {
            throw new IllegalStateException("Discovered database " + id + " is read-only");
          }
          Path source = Path.of(record.getSourceFilePath());
          FastaFileInspector.check(source, record.getMolType());
          DatabaseRecord creating = record.toBuilder().status(DatabaseStatus.CREATING).build();
          records.put(id, creating);
          store.set(id, creating);
          try {
            DatabaseRecord ready = build(creating);
            log.info("Database {} ({}) rebuilt", record.getName(), id);
            return ready;
          } catch (RuntimeException e) {
            log.error("Failed to rebuild database {}", id, e);
            DatabaseRecord failed = record.toBuilder().status(DatabaseStatus.ERROR).build();
            records.put(id, failed);
            store.set(id, failed);
            throw e;
          }
        });
  }

  /**
   * Checks that the files of a database are still on disk. A database with none of its files left
   * is removed from the catalog; one with only some of them is marked as failed.
   *
   * @return true if every expected file exists
   */
  public boolean validate(String id) {
    DatabaseRecord record = records.get(id);
    if (record == null) {
      return false;
    }
    if (record.getStatus() == DatabaseStatus.CREATING) {
      return false;
    }
    return withLock(
        id,
        () -> {
          DatabaseRecord current = records.get(id);
          if (current == null) {
            return false;
          }
          Path base = Path.of(current.getBasePath());
          if (DatabaseFiles.isComplete(base, current.getMolType())) {
            DatabaseRecord validated =
                current.toBuilder()
                    .status(DatabaseStatus.READY)
                    .lastValidated(clock.instant())
                    .build();
            records.put(id, validated);
            if (validated.getOrigin() == DatabaseOrigin.CUSTOM) {
              store.set(id, validated);
            }
            return true;
          }
          if (DatabaseFiles.isAbsent(base, current.getMolType())) {
            log.warn("Files of database {} are missing, removing it from the catalog", id);
            forget(id);
          } else {
            log.warn("Files of database {} are incomplete", id);
            DatabaseRecord failed = current.toBuilder().status(DatabaseStatus.ERROR).build();
            records.put(id, failed);
            if (failed.getOrigin() == DatabaseOrigin.CUSTOM) {
              store.set(id, failed);
            }
          }
          return false;
        });
  }

  /**
   * Adds the databases of the database directory that are not in the catalog yet.
   *
   * @return the records added
   */
  public List<DatabaseRecord> discover() {
    if (!Files.isDirectory(databaseDirectory)) {
      log.debug("Database directory {} does not exist, nothing to discover", databaseDirectory);
      return List.of();
    }
    List<DiscoveredDatabase> found = builder.list(databaseDirectory);
    List<DatabaseRecord> added =
        found.stream()
            .map(this::registerDiscovered)
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
    log.info("Discovered {} new databases in {}", added.size(), databaseDirectory);
    return added;
  }

  public List<DatabaseRecord> list() {
    return records.values().stream()
        .sorted(Comparator.comparing(DatabaseRecord::getName, String.CASE_INSENSITIVE_ORDER))
        .collect(Collectors.toList());
  }

  public Optional<DatabaseRecord> find(String id) {
    return Optional.ofNullable(records.get(id));
  }

  /**
   * Finds the catalog record a database reference points to: a registry id, the id with an extra
   * {@code custom_} prefix, or a database name.
   */
  public Optional<DatabaseRecord> lookup(String databaseRef) {
    if (StringUtils.isBlank(databaseRef)) {
      return Optional.empty();
    }
    DatabaseRecord record = records.get(databaseRef);
    if (record == null && databaseRef.startsWith(CUSTOM_PREFIX)) {
      record = records.get(databaseRef.substring(CUSTOM_PREFIX.length()));
    }
    if (record != null) {
      return Optional.of(record);
    }
    return findByName(databaseRef);
  }

  /**
   * Resolves a database reference to the base path handed to the search tools. References that are
   * not in the catalog are taken relative to the database directory. Has no side effects.
   */
  public Path resolvePath(String databaseRef) {
    if (StringUtils.isBlank(databaseRef)) {
      throw new DatabaseNotFoundException("Database reference is empty");
    }
    Optional<DatabaseRecord> record = lookup(databaseRef);
    if (record.isPresent()) {
      return Path.of(record.get().getBasePath());
    }
    Path path = Path.of(databaseRef);
    return path.isAbsolute() ? path.normalize() : databaseDirectory.resolve(path).normalize();
  }

  private DatabaseRecord build(DatabaseRecord creating) {
    Path base = Path.of(creating.getBasePath());
    builder.build(
        Path.of(creating.getSourceFilePath()), base, creating.getName(), creating.getMolType());
    if (!DatabaseFiles.isComplete(base, creating.getMolType())) {
      throw new BlastException("Database builder produced no files for " + creating.getName());
    }
    DatabaseInfo info = builder.info(base);
    DatabaseRecord ready =
        creating.toBuilder()
            .status(DatabaseStatus.READY)
            .title(StringUtils.defaultIfBlank(info.getTitle(), creating.getName()))
            .sequenceCount(info.getSequenceCount())
            .letterCount(info.getLetterCount())
            .lastValidated(clock.instant())
            .build();
    records.put(ready.getId(), ready);
    store.set(ready.getId(), ready);
    return ready;
  }

  private Optional<DatabaseRecord> registerDiscovered(DiscoveredDatabase database) {
    Path base = Path.of(database.getBasePath()).toAbsolutePath().normalize();
    String name = base.getFileName().toString();
    synchronized (catalogLock) {
      boolean known =
          records.values().stream()
              .anyMatch(
                  record ->
                      base.toString().equals(record.getBasePath())
                          || name.equalsIgnoreCase(record.getName()));
      if (known) {
        return Optional.empty();
      }
      DatabaseRecord record =
          DatabaseRecord.builder()
              .id(DISCOVERED_PREFIX + sanitize(name))
              .name(name)
              .title(name)
              .molType(database.getMolType())
              .status(DatabaseStatus.READY)
              .origin(DatabaseOrigin.DISCOVERED)
              .directory(base.getParent().toString())
              .basePath(base.toString())
              .createdAt(clock.instant())
              .lastValidated(clock.instant())
              .build();
      records.put(record.getId(), record);
    }
    String id = DISCOVERED_PREFIX + sanitize(name);
    try {
      DatabaseInfo info = builder.info(base);
      records.computeIfPresent(
          id,
          (key, record) ->
              record.toBuilder()
                  .title(StringUtils.defaultIfBlank(info.getTitle(), name))
                  .sequenceCount(info.getSequenceCount())
                  .letterCount(info.getLetterCount())
                  .build());
    } catch (BlastException e) {
      log.warn("Cannot read statistics of discovered database {}: {}", base, e.getMessage());
    }
    return Optional.ofNullable(records.get(id));
  }

  private Optional<DatabaseRecord> findByName(String name) {
    return records.values().stream()
        .filter(record -> record.getName().equalsIgnoreCase(name.trim()))
        .findFirst();
  }

  private DatabaseRecord require(String id) {
    DatabaseRecord record = records.get(id);
    if (record == null) {
      throw new DatabaseNotFoundException("Database not found: " + id);
    }
    return record;
  }

  private void forget(String id) {
    DatabaseRecord removed = records.remove(id);
    if (removed == null || removed.getOrigin() != DatabaseOrigin.DISCOVERED) {
      store.remove(id);
    }
  }

  private String newId(String name) {
    String id = CUSTOM_PREFIX + sanitize(name) + "_" + clock.millis();
    while (records.containsKey(id)) {
      id = id + "_";
    }
    return id;
  }

  private static String sanitize(String name) {
    return name.trim().replaceAll("[^a-zA-Z0-9_]", "_");
  }

  private static void checkNotCreating(DatabaseRecord record, String action) {
    if (record.getStatus() == DatabaseStatus.CREATING) {
      throw new IllegalStateException(
          "Database " + record.getId() + " is being created and cannot be " + action);
    }
  }

  private static void appendFasta(StringBuilder fasta, String header, String sequence) {
    fasta.append('>').append(header).append('\n');
    for (int i = 0; i < sequence.length(); i += FASTA_LINE_WIDTH) {
      fasta.append(sequence, i, Math.min(sequence.length(), i + FASTA_LINE_WIDTH)).append('\n');
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Cannot delete {}", file, e);
    }
  }

  private <T> T withLock(String id, Supplier<T> action) {
    ReentrantLock lock = locks.computeIfAbsent(id, key -> new ReentrantLock());
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
