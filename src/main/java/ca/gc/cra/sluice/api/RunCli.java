package ca.gc.cra.sluice.api;

import ca.gc.cra.sluice.application.pipeline.Pipeline;
import ca.gc.cra.sluice.application.port.Stage;
import ca.gc.cra.sluice.application.port.context.ExecutionContext;
import ca.gc.cra.sluice.config.CompositionRoot;
import ca.gc.cra.sluice.config.ConfigMerger;
import ca.gc.cra.sluice.config.PipelineDefinitionLoader;
import ca.gc.cra.sluice.config.RunConfig;
import ca.gc.cra.sluice.config.RunDefaults;
import ca.gc.cra.sluice.config.YamlConfigLoader;
import ca.gc.cra.sluice.domain.run.ExitCodeFailureException;
import ca.gc.cra.sluice.domain.run.RunVerdict;
import ca.gc.cra.sluice.domain.run.RunnerException;
import ca.gc.cra.sluice.domain.run.TopologyException;
import ca.gc.cra.sluice.domain.stage.StageDescriptor;
import ca.gc.cra.sluice.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.sluice.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@code sluice run}: loads a pipeline definition, merges settings and runs the stages.
 * <p><strong>Exit codes:</strong> see {@link ExitCode}; extractor or loader failures map to
 * {@link ExitCode#EXTRACT_LOAD_FAILURE}, other run failures to {@link ExitCode#RUNTIME_FAILURE}.</p>
 * <p><strong>Failure handling:</strong> when a run aborts, stages still alive are force-stopped before returning.</p>
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  static final String SECTION = "run";
  private static final String SUMMARY_USAGE =
      "usage: run config=PIPELINE.yaml [bufferSize=BYTES] [runId=ID] [jobName=NAME] [runDir=PATH] "
          + "[runLog=PATH] [traceStdout=true|false] [metricsExporter=otlp|none] [otelEndpoint=URL] "
          + "[otelResourceAttributes=K=V,...] [--dry-run]";
  private static final String HELP_TEXT = """
      SLUICE run

      Usage:
        run config=./pipeline.yaml [options]

      Required:
        config=PATH                YAML file with a 'run' section listing the stages in order

      Optional (CLI overrides YAML, YAML overrides defaults):
        bufferSize=BYTES           Stream buffer size; a single output line may use half (default 10485760)
        runId=ID                   Run identifier [A-Za-z0-9._-] (default random UUID)
        jobName=NAME               Job name for logs (default runId)
        runDir=PATH                Directory for per-run files (default <tmp>/sluice/<runId>)
        runLog=PATH                Append every stage output line to PATH as JSON Lines
        traceStdout=true|false     Also log stage stdout (implied by --verbose)
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                  Validate the pipeline and print the plan without starting stages
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private RunCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(CliInput.parse(args));
    System.exit(exit.code());
  }

  static ExitCode run(CliInput input) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for run CLI");
    }
    if (!input.positional().isEmpty()) {
      log.error("Unexpected arguments: {}", input.positional());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(input.settings());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    if (configPath == null) {
      log.error("Missing required config=PATH");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.isRegularFile(yamlPath)) {
      log.error("Configuration file does not exist: {}", yamlPath);
      return ExitCode.IO_ERROR;
    }

    Optional<Map<String, String>> yamlSettings;
    List<StageDescriptor> descriptors;
    try {
      yamlSettings = YamlConfigLoader.load(yamlPath, SECTION);
      descriptors = PipelineDefinitionLoader.load(yamlPath, SECTION);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid pipeline definition: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      return ExitCode.IO_ERROR;
    }

    RunConfig config;
    TelemetrySettings telemetry;
    try {
      Map<String, String> effective =
          ConfigMerger.buildEffectiveConfig(yamlSettings, kv, RunDefaults.asFlatMap(), log::warn);
      config = RunConfig.fromMap(effective);
      telemetry = TelemetryConfigurator.settings(config);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid run settings: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    boolean dryRun = input.hasFlag("--dry-run");
    try (CompositionRoot root = new CompositionRoot(config, descriptors,
        dryRun ? TelemetrySettings.disabled() : telemetry)) {
      Pipeline pipeline = root.pipeline();
      if (dryRun) {
        return dryRun(pipeline, config, descriptors);
      }
      return execute(root, pipeline);
    }
  }

  private static ExitCode dryRun(Pipeline pipeline, RunConfig config, List<StageDescriptor> descriptors) {
    try {
      pipeline.validate();
    } catch (TopologyException ex) {
      log.error("Invalid pipeline: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    List<String> lines = new ArrayList<>();
    lines.add("Run dry-run: no stages will be started.");
    lines.add(" Run id        : " + config.runId());
    lines.add(" Job name      : " + config.jobName());
    lines.add(" Buffer size   : " + config.bufferSize() + " bytes (line limit " + config.bufferSize() / 2 + ")");
    lines.add(" Run directory : " + config.runDirectory());
    lines.add(" Run log       : " + config.runLog().map(Path::toString).orElse("<none>"));
    lines.add(" Stages        :");
    for (int i = 0; i < descriptors.size(); i++) {
      StageDescriptor stage = descriptors.get(i);
      lines.add(String.format("  %d. %-20s %-9s %s", i + 1, stage.id(), stage.role().label(),
          String.join(" ", stage.command())));
    }
    lines.add(" Re-run without --dry-run to execute the pipeline.");
    CliPrinter.printLines(lines);
    return ExitCode.SUCCESS;
  }

  private static ExitCode execute(CompositionRoot root, Pipeline pipeline) {
    RunConfig config = root.config();
    try {
      ExecutionContext context = root.executionContext();
      log.info("Running job {} (run {}) with stages {}", config.jobName(), config.runId(),
          pipeline.stages().stream().map(Stage::id).toList());
      RunVerdict verdict = pipeline.run(context);
      CliPrinter.println(verdict.kind().description() + " (run " + config.runId() + ")");
      return ExitCode.SUCCESS;
    } catch (ExitCodeFailureException ex) {
      log.error("{}: exit codes {}", ex.getMessage(), ex.exitCodes());
      CliPrinter.println(ex.getMessage() + " " + ex.exitCodes());
      return ExitCode.EXTRACT_LOAD_FAILURE;
    } catch (TopologyException ex) {
      log.error("Invalid pipeline: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RunnerException ex) {
      log.error("Run {} failed: {}", config.runId(), ex.getMessage(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid run environment: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Run {} I/O failure", config.runId(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Run {} interrupted; stopping stages", config.runId());
      stopRemaining(pipeline);
      return ExitCode.INTERRUPTED;
    }
  }

  private static void stopRemaining(Pipeline pipeline) {
    boolean interrupted = Thread.interrupted();
    try {
      pipeline.terminate(false);
    } catch (InterruptedException ex) {
      interrupted = true;
      log.warn("Interrupted while stopping stages", ex);
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
