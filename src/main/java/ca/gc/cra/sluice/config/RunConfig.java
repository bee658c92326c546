package ca.gc.cra.sluice.config;

import ca.gc.cra.sluice.application.port.context.ExecutionContext;
import ca.gc.cra.sluice.validation.Numbers;
import ca.gc.cra.sluice.validation.Strings;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Validated settings for one pipeline run.
 *
 * @param bufferSize stream buffer size in bytes; lines may be at most half of it
 * @param runId identifier correlating logs, metrics and run files
 * @param jobName human readable job name; defaults to the run id
 * @param runDirectory directory for per-run files such as stage settings
 * @param runLog optional JSON Lines file receiving every stage output line
 * @param traceStdout whether stage stdout is also logged
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otelEndpoint OTLP endpoint; blank uses the exporter default
 * @param otelResourceAttributes extra OpenTelemetry resource attributes
 * @since 0.1.0
 */
public record RunConfig(
    int bufferSize,
    String runId,
    String jobName,
    Path runDirectory,
    Optional<Path> runLog,
    boolean traceStdout,
    String metricsExporter,
    String otelEndpoint,
    String otelResourceAttributes) {
  public static final String BUFFER_SIZE = "bufferSize";
  public static final String RUN_ID = "runId";
  public static final String JOB_NAME = "jobName";
  public static final String RUN_DIR = "runDir";
  public static final String RUN_LOG = "runLog";
  public static final String TRACE_STDOUT = "traceStdout";
  public static final String METRICS_EXPORTER = "metricsExporter";
  public static final String OTEL_ENDPOINT = "otelEndpoint";
  public static final String OTEL_RESOURCE_ATTRIBUTES = "otelResourceAttributes";

  private static final int MAX_JOB_NAME_LENGTH = 128;

  public RunConfig {
    Numbers.requireRange(BUFFER_SIZE, bufferSize, ExecutionContext.MIN_BUFFER_SIZE,
        ExecutionContext.MAX_BUFFER_SIZE);
    runId = Strings.sanitizeIdentifier(RUN_ID, runId);
    jobName = jobName == null || jobName.isBlank()
        ? runId
        : Strings.requirePrintableAscii(JOB_NAME, jobName, MAX_JOB_NAME_LENGTH);
    Objects.requireNonNull(runDirectory, "runDirectory");
    runLog = Objects.requireNonNullElse(runLog, Optional.empty());
    metricsExporter = metricsExporter == null || metricsExporter.isBlank()
        ? "none"
        : metricsExporter.trim().toLowerCase(Locale.ROOT);
    otelEndpoint = otelEndpoint == null ? "" : otelEndpoint.trim();
    otelResourceAttributes = otelResourceAttributes == null ? "" : otelResourceAttributes.trim();
  }

  /** Settings with a fresh run id and every other value at its default. */
  public static RunConfig defaults() {
    return fromMap(RunDefaults.asFlatMap());
  }

  /**
   * Builds settings from merged flat values.
   *
   * @throws IllegalArgumentException when a value is out of range or malformed
   */
  public static RunConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    int bufferSize = Numbers.parseIntInRange(BUFFER_SIZE,
        valueOr(options, BUFFER_SIZE, Integer.toString(ExecutionContext.DEFAULT_BUFFER_SIZE)),
        ExecutionContext.MIN_BUFFER_SIZE, ExecutionContext.MAX_BUFFER_SIZE);
    String runId = valueOr(options, RUN_ID, generateRunId());
    String jobName = valueOr(options, JOB_NAME, null);
    Path runDirectory = Optional.ofNullable(valueOr(options, RUN_DIR, null))
        .map(Path::of)
        .orElseGet(() -> Path.of(System.getProperty("java.io.tmpdir"), "sluice", Strings.sanitizeIdentifier(
            RUN_ID, runId)));
    Optional<Path> runLog = Optional.ofNullable(valueOr(options, RUN_LOG, null)).map(Path::of);
    boolean traceStdout = Boolean.parseBoolean(valueOr(options, TRACE_STDOUT, "false"));
    return new RunConfig(
        bufferSize,
        runId,
        jobName,
        runDirectory,
        runLog,
        traceStdout,
        valueOr(options, METRICS_EXPORTER, "none"),
        valueOr(options, OTEL_ENDPOINT, ""),
        valueOr(options, OTEL_RESOURCE_ATTRIBUTES, ""));
  }

  private static String valueOr(Map<String, String> options, String key, String fallback) {
    String value = options.get(key);
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static String generateRunId() {
    return UUID.randomUUID().toString();
  }
}
