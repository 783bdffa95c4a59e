package ca.bsd.logcheck.api;

import ca.bsd.logcheck.application.ingest.IngestException;
import ca.bsd.logcheck.application.pipeline.AnalysisResult;
import ca.bsd.logcheck.application.pipeline.AnalyzeUseCase;
import ca.bsd.logcheck.application.port.LogSource;
import ca.bsd.logcheck.config.AnalyzeConfig;
import ca.bsd.logcheck.config.CompositionRoot;
import ca.bsd.logcheck.config.ConfigMerger;
import ca.bsd.logcheck.config.DefaultsForMode;
import ca.bsd.logcheck.config.YamlConfigLoader;
import ca.bsd.logcheck.infrastructure.source.DirectoryLogSource;
import ca.bsd.logcheck.logging.LoggingConfigurator;
import ca.bsd.logcheck.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code analyze} command.
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final String MODE = "analyze";
  private static final String SUMMARY_USAGE =
      "usage: analyze [in=PATH] [out=PATH] [pattern=GLOB] [charset=NAME] [sort=true|false] "
          + "[config=PATH] [--dry-run] [--allow-overwrite] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      BSD sensor log analysis

      Usage:
        analyze in=./input out=./output [options]

      Options:
        in=PATH                  Folder holding radar/image log files (default ./input)
        out=PATH                 Folder receiving reports (default ./output)
        pattern=GLOB             Log file glob inside the input folder (default *.txt)
        charset=NAME             Log file charset (default UTF-8)
        sort=true|false          Sort detections by timestamp then y before export (default true)
        config=PATH              YAML file with common: and analyze: sections
        --dry-run                Validate inputs and print the plan without analyzing
        --allow-overwrite        Permit writing into a non-empty output folder
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Reports:
        detections.json          Every radar and image detection
        categories.txt           Moving and stationary radar detections by category
        comparison.json          Radar/image match percentage and time-frames

      Exit codes:
        0 success, 2 invalid arguments, 3 I/O error, 6 no input files
      """;

  private AnalyzeCli() {}

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
   * Runs the analyze command with the production composition root.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::new);
  }

  /**
   * Runs the analyze command.
   *
   * @param args raw CLI arguments
   * @param roots supplies the composition root once configuration is valid
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args, Supplier<CompositionRoot> roots) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for analyze CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yamlConfig = Optional.empty();
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> defaults = DefaultsForMode.asFlatMap(MODE);
    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(MODE, yamlConfig, kv, defaults, log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    warnUnknownKeys(effective, defaults);

    if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }
    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite =
        input.hasFlag("--allow-overwrite") || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    String metricsExporter = effective.getOrDefault("metricsExporter", "none");
    AnalyzeConfig config;
    try {
      TelemetryConfigurator.configureMetrics(configInputs);
      config = AnalyzeConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (!Files.isDirectory(config.inputDirectory())) {
      log.error("The folder {} does not exist or is not a directory", config.inputDirectory());
      return ExitCode.NO_INPUT;
    }

    Path output;
    try {
      output = Paths.validateWritableDir(config.outputDirectory(), null, !dryRun, allowOverwrite);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze output folder: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      return printDryRunPlan(config, output, allowOverwrite, metricsExporter);
    }

    try (CompositionRoot root = roots.get()) {
      AnalyzeUseCase useCase = root.analyzeUseCase(config);
      log.info("Configured analyze pipeline: input={}, pattern={}, output={}, metricsExporter={}",
          config.inputDirectory(), config.filePattern(), output, metricsExporter);
      AnalysisResult result = useCase.run();
      log.info("Analysis completed: {} radar and {} image detections, match {}%",
          result.ingest().radar().size(),
          result.ingest().image().size(),
          String.format(Locale.ROOT, "%.2f", result.comparison().matchPercentage()));
      return ExitCode.SUCCESS;
    } catch (IngestException ex) {
      log.error("No usable input: {}", ex.getMessage());
      return ExitCode.NO_INPUT;
    } catch (IOException ex) {
      log.error("Analyze pipeline I/O failure writing to {}", output, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Analyze configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in analyze pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode printDryRunPlan(
      AnalyzeConfig config, Path output, boolean allowOverwrite, String metricsExporter) {
    LogSource source = new DirectoryLogSource(config.inputDirectory(), config.filePattern(), config.charset());
    List<LogSource.LogFile> files;
    try {
      files = source.files();
    } catch (IngestException ex) {
      log.error("No usable input: {}", ex.getMessage());
      return ExitCode.NO_INPUT;
    }
    CliPrinter.printLines(
        "Analyze dry-run: no reports will be written.",
        " Input folder      : " + config.inputDirectory(),
        " File pattern      : " + config.filePattern(),
        " Matching files    : " + files.size(),
        " Charset           : " + config.charset().name(),
        " Output folder     : " + output,
        " Sort detections   : " + config.sortDetections(),
        " Allow overwrite   : " + allowOverwrite,
        " Metrics exporter  : " + metricsExporter,
        " Re-run without --dry-run to analyze.");
    for (LogSource.LogFile file : files) {
      CliPrinter.println("   - " + file.name());
    }
    return ExitCode.SUCCESS;
  }

  private static void warnUnknownKeys(Map<String, String> effective, Map<String, String> defaults) {
    for (String key : effective.keySet()) {
      if (!defaults.containsKey(key) && !key.equals("input") && !key.equals("output")) {
        log.warn("Ignoring unknown analyze setting: {}", key);
      }
    }
  }
}
