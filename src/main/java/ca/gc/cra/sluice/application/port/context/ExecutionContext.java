package ca.gc.cra.sluice.application.port.context;

import ca.gc.cra.sluice.application.port.MetricsPort;
import ca.gc.cra.sluice.application.port.StageLogSink;
import ca.gc.cra.sluice.validation.Numbers;
import ca.gc.cra.sluice.validation.Strings;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Read-only bag of per-run configuration injected into each stage before it starts.
 * <p><strong>Why:</strong> Keeps buffer limits, run identifiers, and logging sinks explicit rather than ambient.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; the referenced sink and metrics port are thread-safe.</p>
 *
 * @param runId unique identifier of this run
 * @param jobName logical job name; groups runs of the same pipeline
 * @param bufferSize configured stream buffer size in bytes
 * @param runDirectory directory for files materialized during the run
 * @param logSink destination of per-line stage output events
 * @param traceStdout whether stdout lines are forwarded to {@code logSink}
 * @param metrics metrics port; {@link MetricsPort#NO_OP} when {@code null}
 * @since 0.1.0
 */
public record ExecutionContext(
    String runId,
    String jobName,
    int bufferSize,
    Path runDirectory,
    StageLogSink logSink,
    boolean traceStdout,
    MetricsPort metrics) {

  /** Default stream buffer size: 10 MiB. */
  public static final int DEFAULT_BUFFER_SIZE = 10 * 1024 * 1024;
  /** Smallest accepted buffer size. */
  public static final int MIN_BUFFER_SIZE = 2;
  /** Largest accepted buffer size: 1 GiB. */
  public static final int MAX_BUFFER_SIZE = 1024 * 1024 * 1024;

  /**
   * Validates identifiers and the buffer size.
   *
   * @throws IllegalArgumentException when the run id is blank or the buffer size is out of range
   */
  public ExecutionContext {
    runId = Strings.requireNonBlank("runId", runId);
    jobName = jobName == null || jobName.isBlank() ? runId : jobName.trim();
    Numbers.requireRange("bufferSize", bufferSize, MIN_BUFFER_SIZE, MAX_BUFFER_SIZE);
    runDirectory = Objects.requireNonNull(runDirectory, "runDirectory").toAbsolutePath().normalize();
    logSink = Objects.requireNonNullElse(logSink, StageLogSink.NO_OP);
    metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Maximum accepted length of one output line: half the configured buffer size.
   *
   * @return limit in bytes
   */
  public int lineLengthLimit() {
    return bufferSize / 2;
  }
}
