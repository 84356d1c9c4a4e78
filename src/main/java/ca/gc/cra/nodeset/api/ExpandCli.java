package ca.gc.cra.nodeset.api;

import ca.gc.cra.nodeset.application.expand.ExpansionPipeline;
import ca.gc.cra.nodeset.config.CompositionRoot;
import ca.gc.cra.nodeset.config.ConfigMerger;
import ca.gc.cra.nodeset.config.DefaultsForMode;
import ca.gc.cra.nodeset.config.ExpanderConfig;
import ca.gc.cra.nodeset.config.YamlConfigLoader;
import ca.gc.cra.nodeset.domain.macro.MacroSyntaxException;
import ca.gc.cra.nodeset.domain.record.ConfigRecord;
import ca.gc.cra.nodeset.infrastructure.io.RecordDocumentReader;
import ca.gc.cra.nodeset.infrastructure.io.RecordDocumentWriter;
import ca.gc.cra.nodeset.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.nodeset.logging.LoggingConfigurator;
import ca.gc.cra.nodeset.validation.Paths;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands the macros of every record in a YAML record document.
 *
 * @since 0.1.0
 */
public final class ExpandCli {
  private static final Logger log = LoggerFactory.getLogger(ExpandCli.class);
  private static final String DRY_RUN = "--dry-run";
  private static final String ALLOW_OVERWRITE = "--allow-overwrite";
  private static final Set<String> KNOWN_FLAGS = Set.of(DRY_RUN, ALLOW_OVERWRITE);
  private static final String SUMMARY_USAGE =
      "usage: expand in=PATH [out=PATH] [separator=,] [format=yaml|ndjson] [maxRangeSize=N] "
          + "[config=PATH] [metricsExporter=otlp|none] [otelEndpoint=URL] [--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      Nodeset macro expansion

      Usage:
        expand in=./hosts.yaml [out=./hosts-expanded.yaml] [options]

      Required:
        in=PATH                  YAML document: a sequence of records (property -> value or list of values)

      Optional:
        out=PATH                 Write the expanded records here instead of stdout
        separator=TEXT           Joins the names produced by one $EXPAND(...)$ (default ,)
        format=yaml|ndjson       Output serialization (default yaml)
        maxRangeSize=N           Largest number of names one range token may produce (default 100000)
        config=PATH              YAML file with common/expand sections; CLI values take precedence
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL         OTLP metrics endpoint when exporter=otlp
        --dry-run                Validate inputs and print the plan without expanding
        --allow-overwrite        Replace an existing output file
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private ExpandCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs one expansion and maps failures to exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for expand CLI");
    }

    Map<String, String> kv;
    try {
      input.requireKnownFlags(KNOWN_FLAGS);
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, "expand");
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    ExpanderConfig config;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          yamlConfig, kv, DefaultsForMode.asFlatMap("expand"), log::warn);
      config = ExpanderConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid expand arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (ConfigCliUtils.parseBoolean(effective, "verbose") && !input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    boolean dryRun = input.hasFlag(DRY_RUN) || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite =
        input.hasFlag(ALLOW_OVERWRITE) || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    Path inputPath;
    Optional<Path> outputPath;
    try {
      inputPath = Paths.validateReadableFile(
          config.input().orElseThrow(() -> new IllegalArgumentException("in is required")));
      outputPath = config.output().map(path -> Paths.validateWritableFile(path, allowOverwrite));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid expand path configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, inputPath, outputPath, allowOverwrite);
      return ExitCode.SUCCESS;
    }

    CompositionRoot root = new CompositionRoot(config);
    try {
      return expand(root, inputPath, outputPath);
    } finally {
      if (root.metrics() instanceof OpenTelemetryMetricsAdapter otel) {
        otel.close();
      }
    }
  }

  private static ExitCode expand(CompositionRoot root, Path inputPath, Optional<Path> outputPath) {
    ExpanderConfig config = root.config();
    ExpansionPipeline pipeline = root.pipeline();
    RecordDocumentReader reader = new RecordDocumentReader();
    RecordDocumentWriter writer = new RecordDocumentWriter(config.outputFormat());
    try {
      log.info(
          "Configured expand run: input={}, output={}, separator='{}', maxRangeSize={}, format={}",
          inputPath,
          outputPath.map(Path::toString).orElse("<stdout>"),
          config.separator(),
          config.maxRangeSize(),
          config.outputFormat());
      List<ConfigRecord> records = reader.read(inputPath);
      List<ConfigRecord> expanded = pipeline.processAll(records);
      if (outputPath.isPresent()) {
        try (Writer out = Files.newBufferedWriter(outputPath.get(), StandardCharsets.UTF_8)) {
          writer.write(expanded, out);
        }
      } else {
        StringWriter buffer = new StringWriter();
        writer.write(expanded, buffer);
        CliPrinter.print(buffer.toString());
      }
      log.info("Expanded {} record(s) into {} record(s)", records.size(), expanded.size());
      return ExitCode.SUCCESS;
    } catch (MacroSyntaxException ex) {
      log.error("Macro syntax error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid record document {}: {}", inputPath, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Expand I/O failure while processing {}", inputPath, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in expand", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(
      ExpanderConfig config, Path input, Optional<Path> output, boolean allowOverwrite) {
    CliPrinter.printLines(
        "Expand dry-run: no records will be written.",
        " Input document    : " + input,
        " Output            : " + output.map(Path::toString).orElse("<stdout>"),
        " Output format     : " + config.outputFormat(),
        " Separator         : '" + config.separator() + "'",
        " Max range size    : " + config.maxRangeSize(),
        " Metrics exporter  : " + config.metricsExporter(),
        " Allow overwrite   : " + allowOverwrite,
        " Re-run without --dry-run to expand records.");
  }
}
