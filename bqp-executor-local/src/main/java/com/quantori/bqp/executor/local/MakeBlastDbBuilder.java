package com.quantori.bqp.executor.local;

import com.quantori.bqp.api.model.DatabaseInfo;
import com.quantori.bqp.api.model.DiscoveredDatabase;
import com.quantori.bqp.api.model.MolType;
import com.quantori.bqp.api.service.DatabaseBuilder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/** Builds databases with {@code makeblastdb} and inspects them with {@code blastdbcmd}. */
@Slf4j
public class MakeBlastDbBuilder implements DatabaseBuilder {
  static final String MAKEBLASTDB = "makeblastdb";
  static final String BLASTDBCMD = "blastdbcmd";

  private final LocalBlastProperties properties;
  private final CommandRunner runner;

  public MakeBlastDbBuilder(LocalBlastProperties properties) {
    this(properties, new DefaultCommandRunner());
  }

  public MakeBlastDbBuilder(LocalBlastProperties properties, CommandRunner runner) {
    this.properties = properties;
    this.runner = runner;
  }

  @Override
  public void build(Path sourceFile, Path outputBase, String title, MolType molType) {
    List<String> command =
        List.of(
            properties.executable(MAKEBLASTDB),
            "-in",
            sourceFile.toString(),
            "-dbtype",
            molType.getDbType(),
            "-out",
            outputBase.toString(),
            "-title",
            title);
    log.info("Building {} database {} from {}", molType.getLabel(), outputBase, sourceFile);
    run(MAKEBLASTDB, command, sourceFile.toAbsolutePath().getParent());
  }

  @Override
  public DatabaseInfo info(Path base) {
    List<String> command =
        List.of(properties.executable(BLASTDBCMD), "-db", base.toString(), "-info");
    return BlastDbInfoParser.parseInfo(run(BLASTDBCMD, command, null).getStdout());
  }

  @Override
  public List<DiscoveredDatabase> list(Path directory) {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    List<String> command =
        List.of(
            properties.executable(BLASTDBCMD),
            "-list",
            directory.toString(),
            "-list_outfmt",
            "%f %p");
    return BlastDbInfoParser.parseList(run(BLASTDBCMD, command, null).getStdout());
  }

  private ProcessResult run(String tool, List<String> command, Path workingDirectory) {
    ProcessResult result =
        runner.run(command, Map.of(), workingDirectory, properties.getProcessTimeout());
    if (!result.isSuccess()) {
      throw ProcessFailureClassifier.toException(tool, result);
    }
    return result;
  }
}
