package com.quantori.bqp.core.database;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.bqp.api.DatabaseAlreadyExistsException;
import com.quantori.bqp.api.DatabaseNotFoundException;
import com.quantori.bqp.api.ProcessExecutionException;
import com.quantori.bqp.api.UnsupportedFormatException;
import com.quantori.bqp.api.ValidationException;
import com.quantori.bqp.api.model.DatabaseInfo;
import com.quantori.bqp.api.model.DatabaseOrigin;
import com.quantori.bqp.api.model.DatabaseRecord;
import com.quantori.bqp.api.model.DatabaseStatus;
import com.quantori.bqp.api.model.DiscoveredDatabase;
import com.quantori.bqp.api.model.MolType;
import com.quantori.bqp.api.util.DatabaseFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DatabaseRegistryTest {
  private static final String FASTA =
      ">gene1 test\nATGCGTACGTTAGCATGC\n>gene2\nTTAGCATGCGTACG\n";
  private static final String REGION =
      "ATGAAACCCGGGTTTCATGCAAGCTATGAAACCCGGGTTTCATGCAAGCTATGAAACCC";

  @TempDir Path directory;

  private final DatabaseRegistry[] registryRef = new DatabaseRegistry[1];

  private InMemoryConfigStore store;
  private FakeDatabaseBuilder builder;
  private DatabaseRegistry registry;
  private Path databaseDirectory;

  @BeforeEach
  void setUp() throws IOException {
    store = new InMemoryConfigStore();
    builder = new FakeDatabaseBuilder();
    databaseDirectory = Files.createDirectories(directory.resolve("databases"));
    registry =
        new DatabaseRegistry(
            store,
            builder,
            databaseDirectory,
            (chromosome, start, end) -> REGION,
            Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));
  }

  @Test
  void createValidateDeleteRoundTrip() throws IOException {
    Path source = fasta("genes.fasta", FASTA);

    DatabaseRecord record = registry.create(source, "My Genes", MolType.NUCLEOTIDE);

    assertThat(record.getId(), startsWith("custom_My_Genes_"));
    assertEquals(DatabaseStatus.READY, record.getStatus());
    assertEquals(DatabaseOrigin.CUSTOM, record.getOrigin());
    assertEquals(2, record.getSequenceCount());
    assertEquals(source.getParent().resolve(record.getId()).toString(), record.getBasePath());
    assertTrue(store.get(record.getId()).isPresent());
    assertTrue(registry.validate(record.getId()));

    registry.delete(record.getId());

    assertFalse(registry.validate(record.getId()));
    assertTrue(store.get(record.getId()).isEmpty());
    assertTrue(DatabaseFiles.isAbsent(Path.of(record.getBasePath()), MolType.NUCLEOTIDE));
  }

  @Test
  void duplicateNamesAreRejected() throws IOException {
    Path source = fasta("genes.fasta", FASTA);
    registry.create(source, "Genes", MolType.NUCLEOTIDE);

    assertThrows(
        DatabaseAlreadyExistsException.class,
        () -> registry.create(source, "genes", MolType.NUCLEOTIDE));
    assertThat(builder.built, hasSize(1));
  }

  @Test
  void genBankFilesAreRejected() throws IOException {
    Path source = fasta("record.gb", "LOCUS       NC_000913   4641652 bp    DNA\nORIGIN\n");

    assertThrows(
        UnsupportedFormatException.class,
        () -> registry.create(source, "genbank", MolType.NUCLEOTIDE));
    assertThat(registry.list(), hasSize(0));
  }

  @Test
  void blankNameIsRejected() throws IOException {
    Path source = fasta("genes.fasta", FASTA);

    assertThrows(ValidationException.class, () -> registry.create(source, " ", MolType.PROTEIN));
  }

  @Test
  void failedBuildLeavesNoRecord() throws IOException {
    Path source = fasta("genes.fasta", FASTA);
    builder.failBuild = true;

    assertThrows(
        ProcessExecutionException.class,
        () -> registry.create(source, "broken", MolType.NUCLEOTIDE));
    assertThat(registry.list(), hasSize(0));
    assertThat(store.listAll(), hasSize(0));
  }

  @Test
  void failureAfterBuildRemovesDatabaseFiles() throws IOException {
    Path source = fasta("genes.fasta", FASTA);
    DatabaseRegistry unreadable = registryWith(unreadableInfoBuilder());

    assertThrows(
        IllegalStateException.class,
        () -> unreadable.create(source, "genes", MolType.NUCLEOTIDE));
    assertThat(unreadable.list(), hasSize(0));
    assertThat(store.listAll(), hasSize(0));
    try (Stream<Path> files = Files.list(source.getParent())) {
      assertEquals(List.of(source), files.collect(Collectors.toList()));
    }
  }

  @Test
  void failedGenomeBuildLeavesEmptyDirectory() throws IOException {
    DatabaseRegistry unreadable = registryWith(unreadableInfoBuilder());

    assertThrows(
        IllegalStateException.class,
        () -> unreadable.createFromGenome("chr1", 100, 158, "region", MolType.NUCLEOTIDE));
    assertThat(unreadable.list(), hasSize(0));
    try (Stream<Path> files = Files.list(databaseDirectory)) {
      assertEquals(0, files.count());
    }
  }

  @Test
  void loadDropsUnfinishedBuilds() throws IOException {
    Path source = fasta("genes.fasta", FASTA);
    DatabaseRecord record = registry.create(source, "genes", MolType.NUCLEOTIDE);
    store.set(record.getId(), record.toBuilder().status(DatabaseStatus.CREATING).build());
    registry.load(false);

    assertThat(registry.list(), hasSize(0));
    assertTrue(store.get(record.getId()).isEmpty());
  }

  @Test
  void creatingRecordBlocksDeleteAndUpdate() throws IOException {
    Path source = fasta("genes.fasta", FASTA);
    DatabaseRegistry blocking =
        new DatabaseRegistry(
            store,
            new FakeDatabaseBuilder() {
              @Override
              public void build(Path sourceFile, Path outputBase, String title, MolType molType) {
                String id = outputBase.getFileName().toString();
                assertThrows(IllegalStateException.class, () -> registryRef[0].delete(id));
                assertThrows(IllegalStateException.class, () -> registryRef[0].update(id));
                assertFalse(registryRef[0].validate(id));
                super.build(sourceFile, outputBase, title, molType);
              }
            },
            databaseDirectory);
    registryRef[0] = blocking;

    DatabaseRecord record = blocking.create(source, "genes", MolType.NUCLEOTIDE);

    assertEquals(DatabaseStatus.READY, record.getStatus());
  }

  @Test
  void partialFilesMarkDatabaseAsFailed() throws IOException {
    DatabaseRecord record =
        registry.create(fasta("genes.fasta", FASTA), "genes", MolType.NUCLEOTIDE);
    Files.delete(Path.of(record.getBasePath() + ".nsq"));

    assertFalse(registry.validate(record.getId()));
    assertEquals(DatabaseStatus.ERROR, registry.find(record.getId()).get().getStatus());
  }

  @Test
  void updateRebuildsFromSource() throws IOException {
    DatabaseRecord record =
        registry.create(fasta("genes.fasta", FASTA), "genes", MolType.NUCLEOTIDE);

    DatabaseRecord updated = registry.update(record.getId());

    assertEquals(record.getId(), updated.getId());
    assertEquals(DatabaseStatus.READY, updated.getStatus());
    assertThat(builder.built, hasSize(2));
  }

  @Test
  void failedUpdateMarksDatabaseAsFailed() throws IOException {
    DatabaseRecord record =
        registry.create(fasta("genes.fasta", FASTA), "genes", MolType.NUCLEOTIDE);
    builder.failBuild = true;

    assertThrows(ProcessExecutionException.class, () -> registry.update(record.getId()));
    assertEquals(DatabaseStatus.ERROR, registry.find(record.getId()).get().getStatus());
  }

  @Test
  void resolvePathIsIdempotent() throws IOException {
    DatabaseRecord record =
        registry.create(fasta("genes.fasta", FASTA), "genes", MolType.NUCLEOTIDE);

    Path byId = registry.resolvePath(record.getId());
    Path byName = registry.resolvePath("genes");
    Path unknown = registry.resolvePath("nt");

    assertEquals(byId, registry.resolvePath(record.getId()));
    assertEquals(byId, byName);
    assertEquals(byId, registry.resolvePath(byId.toString()));
    assertEquals(databaseDirectory.resolve("nt"), unknown);
    assertEquals(unknown, registry.resolvePath(unknown.toString()));
    assertThrows(DatabaseNotFoundException.class, () -> registry.resolvePath(""));
  }

  @Test
  void lookupAcceptsDoublePrefixedId() throws IOException {
    DatabaseRecord record =
        registry.create(fasta("genes.fasta", FASTA), "genes", MolType.NUCLEOTIDE);

    assertEquals(record.getId(), registry.lookup("custom_" + record.getId()).get().getId());
  }

  @Test
  void discoveredDatabasesAreReadOnly() throws IOException {
    Path base = databaseDirectory.resolve("ecoli");
    for (Path file : DatabaseFiles.expectedFiles(base, MolType.NUCLEOTIDE)) {
      Files.write(file, new byte[] {1});
    }
    builder.onDisk.add(
        DiscoveredDatabase.builder().basePath(base.toString()).molType(MolType.NUCLEOTIDE).build());

    List<DatabaseRecord> added = registry.discover();

    assertThat(added, hasSize(1));
    DatabaseRecord record = added.get(0);
    assertEquals("discovered_ecoli", record.getId());
    assertEquals(DatabaseOrigin.DISCOVERED, record.getOrigin());
    assertTrue(store.listAll().isEmpty());
    assertThat(registry.discover(), hasSize(0));
    assertThrows(IllegalStateException.class, () -> registry.update(record.getId()));

    registry.delete(record.getId());

    assertFalse(DatabaseFiles.isAbsent(base, MolType.NUCLEOTIDE));
  }

  @Test
  void loadRestoresAndValidatesCatalog() throws IOException {
    DatabaseRecord kept = registry.create(fasta("a.fasta", FASTA), "alpha", MolType.NUCLEOTIDE);
    DatabaseRecord lost = registry.create(fasta("b.fasta", FASTA), "beta", MolType.NUCLEOTIDE);
    DatabaseFiles.deleteArtifacts(Path.of(lost.getBasePath()), MolType.NUCLEOTIDE);

    DatabaseRegistry reloaded = new DatabaseRegistry(store, builder, databaseDirectory);
    reloaded.load(false);

    assertThat(
        reloaded.list().stream().map(DatabaseRecord::getId).collect(Collectors.toList()),
        contains(kept.getId()));
    assertTrue(store.get(lost.getId()).isEmpty());
  }

  @Test
  void genomeRegionBecomesProteinDatabase() throws IOException {
    DatabaseRecord record = registry.createFromGenome("chr1", 100, 158, "region", MolType.PROTEIN);

    Path fasta = Path.of(record.getSourceFilePath());
    assertEquals(databaseDirectory.resolve("region_prot.fasta"), fasta);
    List<String> headers =
        Files.readAllLines(fasta).stream()
            .filter(line -> line.startsWith(">"))
            .collect(Collectors.toList());
    assertThat(headers.get(0), is(">chr1_100_158_frame_+1"));
    assertThat(headers, hasSize(6));
    assertEquals(MolType.PROTEIN, record.getMolType());
  }

  @Test
  void listIsSortedByName() throws IOException {
    registry.create(fasta("b.fasta", FASTA), "beta", MolType.NUCLEOTIDE);
    registry.create(fasta("a.fasta", FASTA), "Alpha", MolType.NUCLEOTIDE);

    assertThat(
        registry.list().stream().map(DatabaseRecord::getName).collect(Collectors.toList()),
        contains("Alpha", "beta"));
  }

  private DatabaseRegistry registryWith(FakeDatabaseBuilder databaseBuilder) {
    return new DatabaseRegistry(
        store,
        databaseBuilder,
        databaseDirectory,
        (chromosome, start, end) -> REGION,
        Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));
  }

  private static FakeDatabaseBuilder unreadableInfoBuilder() {
    return new FakeDatabaseBuilder() {
      @Override
      public DatabaseInfo info(Path base) {
        assertFalse(DatabaseFiles.isAbsent(base, MolType.NUCLEOTIDE));
        throw new IllegalStateException("blastdbcmd could not read " + base);
      }
    };
  }

  private Path fasta(String name, String content) throws IOException {
    Path sources = Files.createDirectories(directory.resolve("sources"));
    return Files.writeString(sources.resolve(name), content);
  }
}
