package com.quantori.bqp.executor.local;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.quantori.bqp.api.ProcessExecutionException;
import com.quantori.bqp.api.model.DatabaseInfo;
import com.quantori.bqp.api.model.DiscoveredDatabase;
import com.quantori.bqp.api.model.MolType;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class MakeBlastDbBuilderTest {
  @TempDir Path directory;

  private CommandRunner runner;
  private MakeBlastDbBuilder builder;

  @BeforeEach
  void setUp() {
    runner = mock(CommandRunner.class);
    builder =
        new MakeBlastDbBuilder(
            LocalBlastProperties.builder()
                .tempDirectory(directory)
                .processTimeout(Duration.ofMinutes(5))
                .build(),
            runner);
  }

  @Test
  void buildRunsInSourceDirectory() {
    Path source = directory.resolve("kinases.fasta");
    Path output = directory.resolve("custom_kinases_1");
    when(runner.run(anyList(), anyMap(), any(), any()))
        .thenReturn(new ProcessResult("makeblastdb", 0, "", ""));

    builder.build(source, output, "Kinases", MolType.PROTEIN);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
    verify(runner).run(command.capture(), anyMap(), eq(directory), eq(Duration.ofMinutes(5)));
    assertThat(
        command.getValue(),
        contains(
            "makeblastdb",
            "-in",
            source.toString(),
            "-dbtype",
            "prot",
            "-out",
            output.toString(),
            "-title",
            "Kinases"));
  }

  @Test
  void buildFailureCarriesDiagnostics() {
    when(runner.run(anyList(), anyMap(), any(), any()))
        .thenReturn(new ProcessResult("makeblastdb", 1, "", "FASTA-reader: no sequences"));

    ProcessExecutionException exception =
        assertThrows(
            ProcessExecutionException.class,
            () ->
                builder.build(
                    directory.resolve("a.fasta"), directory.resolve("a"), "a", MolType.NUCLEOTIDE));

    assertThat(exception.getDiagnostics(), is("FASTA-reader: no sequences"));
  }

  @Test
  void infoParsesReport() {
    when(runner.run(anyList(), anyMap(), any(), any()))
        .thenReturn(
            new ProcessResult(
                "blastdbcmd", 0, "Database: genes\n\t3 sequences; 1,200 total bases\n", ""));

    DatabaseInfo info = builder.info(directory.resolve("genes"));

    assertThat(info.getSequenceCount(), is(3L));
    assertThat(info.getLetterCount(), is(1200L));
  }

  @Test
  void listSkipsMissingDirectory() {
    assertThat(builder.list(directory.resolve("missing")), is(empty()));
    verifyNoInteractions(runner);
  }

  @Test
  void listParsesReport() {
    when(runner.run(anyList(), anyMap(), any(), any()))
        .thenReturn(new ProcessResult("blastdbcmd", 0, directory + "/genes Nucleotide\n", ""));

    List<DiscoveredDatabase> databases = builder.list(directory);

    assertThat(databases, hasSize(1));
    assertThat(databases.get(0).getMolType(), is(MolType.NUCLEOTIDE));
  }
}
