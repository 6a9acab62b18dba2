package com.quantori.bqp.cli;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.quantori.bqp.api.ValidationException;
import com.quantori.bqp.api.model.BlastProgram;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.ServiceType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliArgumentsTest {

  @Test
  void buildsRequest() {
    SearchRequest request =
        CliArguments.parse(
                "--sequence", "ATGCGTACGTTAGC",
                "--program", "blastp",
                "--service", "remote",
                "--database", "swissprot",
                "--evalue", "0.001",
                "--max-targets", "5",
                "--matrix", "PAM30",
                "--gap-open", "9",
                "--low-complexity")
            .toRequest();

    assertThat(request.getProgram(), is(BlastProgram.BLASTP));
    assertThat(request.getService(), is(ServiceType.REMOTE));
    assertThat(request.getDatabase(), is("swissprot"));
    assertThat(request.getEvalueThreshold(), is(0.001));
    assertThat(request.getMaxTargets(), is(5));
    assertThat(request.getAdvanced().getMatrix(), is("PAM30"));
    assertThat(request.getAdvanced().getGapOpen(), is(9));
    assertThat(request.getAdvanced().getGapExtend(), is(nullValue()));
    assertThat(request.getAdvanced().isLowComplexityFilter(), is(true));
  }

  @Test
  void checkInstallationIsAFlag() {
    CliArguments arguments =
        CliArguments.parse("--check-installation", "--set", "bqp.local.bin-directory=/opt/blast");

    assertThat(arguments.isCheckInstallation(), is(true));
    assertThat(arguments.isListDatabases(), is(false));
    assertThat(arguments.getConfigOverrides(), hasEntry("bqp.local.bin-directory", "/opt/blast"));
  }

  @Test
  void defaultsApplyWhenOmitted() {
    SearchRequest request =
        CliArguments.parse("--sequence", "ATGC", "--program", "blastn").toRequest();

    assertThat(request.getEvalueThreshold(), is(SearchRequest.DEFAULT_EVALUE));
    assertThat(request.getMaxTargets(), is(SearchRequest.DEFAULT_MAX_TARGETS));
    assertThat(request.getService(), is(nullValue()));
  }

  @Test
  void readsQueryFile(@TempDir Path directory) throws IOException {
    Path file = Files.writeString(directory.resolve("query.fasta"), ">q1\nATGCGTACGT\nTAGC\n");

    SearchRequest request = CliArguments.parse("--query-file", file.toString()).toRequest();

    assertThat(request.getSequence(), is(">q1\nATGCGTACGT\nTAGC\n"));
  }

  @Test
  void collectsConfigOverrides() {
    CliArguments arguments =
        CliArguments.parse(
            "--set", "bqp.ncbi.max-attempts=10", "--set", "bqp.ncbi.email=me@example.org");

    assertThat(arguments.getConfigOverrides(), hasEntry("bqp.ncbi.max-attempts", "10"));
    assertThat(arguments.getConfigOverrides(), hasEntry("bqp.ncbi.email", "me@example.org"));
  }

  @Test
  void rejectsMalformedInput() {
    assertThrows(ValidationException.class, () -> CliArguments.parse("--unknown", "x"));
    assertThrows(ValidationException.class, () -> CliArguments.parse("--program"));
    assertThrows(ValidationException.class, () -> CliArguments.parse("positional"));
    assertThrows(ValidationException.class, () -> CliArguments.parse("--set", "novalue"));
    assertThrows(
        ValidationException.class,
        () -> CliArguments.parse("--program", "tblastx").toRequest());
    assertThrows(
        ValidationException.class,
        () -> CliArguments.parse("--max-targets", "many").toRequest());
    assertThrows(
        ValidationException.class,
        () -> CliArguments.parse("--sequence", "A", "--query-file", "q.fa").toRequest());
    assertThrows(ValidationException.class, () -> CliArguments.parse("--format", "xml").isJson());
  }
}
