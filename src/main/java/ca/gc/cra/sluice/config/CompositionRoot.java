package ca.gc.cra.sluice.config;

import ca.gc.cra.sluice.application.pipeline.Pipeline;
import ca.gc.cra.sluice.application.port.MetricsPort;
import ca.gc.cra.sluice.application.port.StageLogSink;
import ca.gc.cra.sluice.application.port.context.ExecutionContext;
import ca.gc.cra.sluice.domain.stage.StageDescriptor;
import ca.gc.cra.sluice.infrastructure.hooks.ConfigFileStageHooks;
import ca.gc.cra.sluice.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.sluice.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.sluice.infrastructure.output.CompositeStageLogSink;
import ca.gc.cra.sluice.infrastructure.output.JsonLinesStageLogSink;
import ca.gc.cra.sluice.infrastructure.output.Slf4jStageLogSink;
import ca.gc.cra.sluice.infrastructure.process.ProcessStageFactory;
import ca.gc.cra.sluice.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the adapters for one run: process stages, log sinks, metrics and the execution
 * context.
 * <p><strong>Lifecycle:</strong> Create one root per run and close it after {@link Pipeline#run(ExecutionContext)}
 * returns; closing flushes metrics, closes the run log and releases proxy threads.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final RunConfig config;
  private final List<StageDescriptor> stages;
  private final TelemetrySettings telemetry;
  private ProcessStageFactory stageFactory;
  private OpenTelemetryMetricsAdapter metrics;
  private JsonLinesStageLogSink runLog;

  public CompositionRoot(RunConfig config, List<StageDescriptor> stages, TelemetrySettings telemetry) {
    this.config = Objects.requireNonNull(config, "config");
    this.stages = List.copyOf(Objects.requireNonNull(stages, "stages"));
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
  }

  public RunConfig config() {
    return config;
  }

  /** Pipeline of process stages whose hooks write per-stage settings files. */
  public Pipeline pipeline() {
    if (stageFactory == null) {
      stageFactory = new ProcessStageFactory(ConfigFileStageHooks::new);
    }
    return Pipeline.of(stages.stream().map(stageFactory::create).toList());
  }

  /**
   * Builds the execution context, creating the run directory and opening the run log when configured.
   *
   * @throws IOException when the run log cannot be opened
   * @throws IllegalArgumentException when the run directory or run log path is unusable
   */
  public ExecutionContext executionContext() throws IOException {
    Path runDirectory = Paths.validateWritableDir(config.runDirectory(), true);
    List<StageLogSink> sinks = new ArrayList<>();
    sinks.add(new Slf4jStageLogSink(config.runId()));
    if (config.runLog().isPresent() && runLog == null) {
      Path file = Paths.validateWritableFile(config.runLog().get(), true);
      runLog = new JsonLinesStageLogSink(file, config.runId());
      log.info("Writing stage output for run {} to {}", config.runId(), file);
    }
    if (runLog != null) {
      sinks.add(runLog);
    }
    return new ExecutionContext(
        config.runId(),
        config.jobName(),
        config.bufferSize(),
        runDirectory,
        CompositeStageLogSink.of(sinks),
        config.traceStdout() || LoggerFactory.getLogger(Slf4jStageLogSink.LOGGER_NAME).isDebugEnabled(),
        metrics());
  }

  MetricsPort metrics() {
    if (metrics == null) {
      metrics = new OpenTelemetryMetricsAdapter(telemetry);
    }
    return metrics;
  }

  @Override
  public void close() {
    if (runLog != null) {
      try {
        runLog.close();
      } catch (IOException ex) {
        log.warn("Failed to close run log {}", runLog.file(), ex);
      }
    }
    if (stageFactory != null) {
      stageFactory.close();
    }
    if (metrics != null) {
      metrics.close();
    }
  }
}
