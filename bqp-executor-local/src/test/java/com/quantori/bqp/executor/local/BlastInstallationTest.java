package com.quantori.bqp.executor.local;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.quantori.bqp.api.ProcessExecutionException;
import com.quantori.bqp.api.ProcessFailureKind;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class BlastInstallationTest {
  private final CommandRunner runner = mock(CommandRunner.class);

  private final BlastInstallation installation =
      new BlastInstallation(
          LocalBlastProperties.builder()
              .binDirectory(Path.of("/opt/blast/bin"))
              .tempDirectory(Path.of("/tmp"))
              .processTimeout(Duration.ofMinutes(5))
              .build(),
          runner);

  @Test
  void versionIsReadFromBlastnOutput() {
    when(runner.run(anyList(), anyMap(), any(), any()))
        .thenReturn(
            new ProcessResult(
                "blastn -version",
                0,
                "blastn: 2.15.0+\n Package: blast 2.15.0, build Oct 19 2023 13:35:57\n",
                ""));

    assertEquals(Optional.of("2.15.0"), installation.version());

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
    verify(runner)
        .run(command.capture(), anyMap(), eq(null), eq(BlastInstallation.VERSION_TIMEOUT));
    assertThat(
        command.getValue(), contains(Path.of("/opt/blast/bin", "blastn").toString(), "-version"));
  }

  @Test
  void missingExecutableMeansNotInstalled() {
    when(runner.run(anyList(), anyMap(), any(), any()))
        .thenThrow(
            new ProcessExecutionException(
                ProcessFailureKind.MISSING_EXECUTABLE,
                "Cannot start blastn",
                new java.io.IOException("No such file or directory")));

    assertEquals(Optional.empty(), installation.version());
    assertFalse(installation.isInstalled());
  }

  @Test
  void failingExecutableMeansNotInstalled() {
    when(runner.run(anyList(), anyMap(), any(), any()))
        .thenReturn(new ProcessResult("blastn -version", 127, "", "error while loading libs"));

    assertFalse(installation.isInstalled());
  }

  @Test
  void outputWithoutVersionMeansNotInstalled() {
    when(runner.run(anyList(), anyMap(), any(), any()))
        .thenReturn(new ProcessResult("blastn -version", 0, "USAGE\n  blastn [-h]\n", ""));

    assertEquals(Optional.empty(), installation.version());
  }

  @Test
  void installedWhenVersionIsFound() {
    when(runner.run(anyList(), anyMap(), any(), any()))
        .thenReturn(new ProcessResult("blastn -version", 0, "blastn: 2.9.0+\n", ""));

    assertTrue(installation.isInstalled());
  }
}
