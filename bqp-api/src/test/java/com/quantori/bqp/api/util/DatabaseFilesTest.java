package com.quantori.bqp.api.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.bqp.api.model.MolType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DatabaseFilesTest {

  @TempDir Path directory;

  @Test
  void completeOnlyWithEveryCoreFile() throws IOException {
    Path base = directory.resolve("ecoli");
    assertTrue(DatabaseFiles.isAbsent(base, MolType.NUCLEOTIDE));

    Files.write(DatabaseFiles.withSuffix(base, ".nhr"), new byte[] {1});
    Files.write(DatabaseFiles.withSuffix(base, ".nin"), new byte[] {1});
    assertFalse(DatabaseFiles.isComplete(base, MolType.NUCLEOTIDE));
    assertFalse(DatabaseFiles.isAbsent(base, MolType.NUCLEOTIDE));

    Files.write(DatabaseFiles.withSuffix(base, ".nsq"), new byte[] {1});
    assertTrue(DatabaseFiles.isComplete(base, MolType.NUCLEOTIDE));
    assertFalse(DatabaseFiles.isComplete(base, MolType.PROTEIN));
  }

  @Test
  void aliasFileMakesMultiVolumeDatabaseComplete() throws IOException {
    Path base = directory.resolve("nr");
    Files.write(DatabaseFiles.aliasFile(base, MolType.PROTEIN), new byte[] {1});

    assertEquals("nr.pal", DatabaseFiles.aliasFile(base, MolType.PROTEIN).getFileName().toString());
    assertTrue(DatabaseFiles.isComplete(base, MolType.PROTEIN));
  }

  @Test
  void deleteArtifactsLeavesOtherFiles() throws IOException {
    Path base = directory.resolve("ecoli");
    for (String suffix : new String[] {".nhr", ".nin", ".nsq", ".ndb", ".njs"}) {
      Files.write(DatabaseFiles.withSuffix(base, suffix), new byte[] {1});
    }
    Path source = Files.writeString(directory.resolve("ecoli.fasta"), ">a\nACGT\n");

    assertEquals(5, DatabaseFiles.deleteArtifacts(base, MolType.NUCLEOTIDE));
    assertTrue(DatabaseFiles.isAbsent(base, MolType.NUCLEOTIDE));
    assertTrue(Files.exists(source));
  }
}
