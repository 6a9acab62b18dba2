package com.quantori.bqp.cli;

import com.quantori.bqp.api.ValidationException;
import com.quantori.bqp.api.model.AdvancedParameters;
import com.quantori.bqp.api.model.BlastProgram;
import com.quantori.bqp.api.model.SearchRequest;
import com.quantori.bqp.api.model.ServiceType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Command line of the search tool. Options take one value, except the flags. {@code --set
 * key=value} overrides any configuration setting and may be repeated.
 */
@Getter
class CliArguments {
  static final String USAGE =
      String.join(
          "\n",
          "Usage: bqp-search (--sequence <text> | --query-file <path>) --program <blastn|blastp|"
              + "blastx|tblastn>",
          "                  --service <local|remote> --database <name|id|path>",
          "                  [--evalue <number>] [--max-targets <n>] [--word-size <n>]",
          "                  [--matrix <name>] [--gap-open <n>] [--gap-extend <n>]",
          "                  [--low-complexity] [--format text|json] [--set key=value]...",
          "       bqp-search --list-databases [--set key=value]...",
          "       bqp-search --check-installation [--set key=value]...");

  private static final Set<String> FLAGS =
      Set.of("low-complexity", "list-databases", "check-installation", "help");
  private static final Set<String> OPTIONS =
      Set.of(
          "sequence",
          "query-file",
          "program",
          "service",
          "database",
          "evalue",
          "max-targets",
          "word-size",
          "matrix",
          "gap-open",
          "gap-extend",
          "format",
          "set");

  private final Map<String, String> options = new HashMap<>();
  private final Map<String, String> configOverrides = new LinkedHashMap<>();
  private boolean lowComplexity;
  private boolean listDatabases;
  private boolean checkInstallation;
  private boolean help;

  static CliArguments parse(String... args) {
    CliArguments arguments = new CliArguments();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--")) {
        throw new ValidationException("Unexpected argument: " + arg);
      }
      String name = arg.substring(2);
      if (FLAGS.contains(name)) {
        arguments.flag(name);
      } else if (OPTIONS.contains(name)) {
        if (i + 1 >= args.length) {
          throw new ValidationException("Missing value for " + arg);
        }
        arguments.option(name, args[++i]);
      } else {
        throw new ValidationException("Unknown option: " + arg);
      }
    }
    return arguments;
  }

  private void flag(String name) {
    switch (name) {
      case "low-complexity":
        lowComplexity = true;
        break;
      case "list-databases":
        listDatabases = true;
        break;
      case "check-installation":
        checkInstallation = true;
        break;
      default:
        help = true;
    }
  }

  private void option(String name, String value) {
    if ("set".equals(name)) {
      String key = StringUtils.substringBefore(value, "=");
      if (StringUtils.isBlank(key) || !value.contains("=")) {
        throw new ValidationException("Expected key=value after --set, got " + value);
      }
      configOverrides.put(key.trim(), StringUtils.substringAfter(value, "="));
    } else {
      options.put(name, value);
    }
  }

  boolean isJson() {
    String format = options.getOrDefault("format", "text");
    if (!"text".equalsIgnoreCase(format) && !"json".equalsIgnoreCase(format)) {
      throw new ValidationException("Unknown output format: " + format);
    }
    return "json".equalsIgnoreCase(format);
  }

  /** Builds the request; the sequence itself is validated by the search engine. */
  SearchRequest toRequest() {
    SearchRequest.SearchRequestBuilder request =
        SearchRequest.builder()
            .sequence(sequence())
            .program(program())
            .service(service())
            .database(options.get("database"))
            .advanced(
                AdvancedParameters.builder()
                    .wordSize(integer("word-size"))
                    .matrix(options.get("matrix"))
                    .gapOpen(integer("gap-open"))
                    .gapExtend(integer("gap-extend"))
                    .lowComplexityFilter(lowComplexity)
                    .build());
    if (options.containsKey("evalue")) {
      request.evalueThreshold(number("evalue"));
    }
    if (options.containsKey("max-targets")) {
      request.maxTargets(integer("max-targets"));
    }
    return request.build();
  }

  private BlastProgram program() {
    String value = options.get("program");
    try {
      return value == null ? null : BlastProgram.fromCommand(value);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Unknown BLAST program: " + value);
    }
  }

  private ServiceType service() {
    String value = options.get("service");
    try {
      return value == null ? null : ServiceType.fromValue(value);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Unknown service: " + value);
    }
  }

  private String sequence() {
    String inline = options.get("sequence");
    String file = options.get("query-file");
    if (inline != null && file != null) {
      throw new ValidationException("Use either --sequence or --query-file, not both");
    }
    if (file == null) {
      return inline;
    }
    try {
      return Files.readString(Path.of(file), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ValidationException("Cannot read query file " + file + ": " + e.getMessage());
    }
  }

  private Integer integer(String name) {
    String value = options.get(name);
    if (value == null) {
      return null;
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException e) {
      throw new ValidationException("--" + name + " expects an integer, got " + value);
    }
  }

  private double number(String name) {
    String value = options.get(name);
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new ValidationException("--" + name + " expects a number, got " + value);
    }
  }
}
