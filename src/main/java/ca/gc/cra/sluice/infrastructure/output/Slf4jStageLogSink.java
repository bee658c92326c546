package ca.gc.cra.sluice.infrastructure.output;

import ca.gc.cra.sluice.application.port.StageLogSink;
import ca.gc.cra.sluice.domain.stage.StreamKind;
import ca.gc.cra.sluice.logging.Logs;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> {@link StageLogSink} that writes stage output through SLF4J.
 * <p><strong>Levels:</strong> stderr lines log at INFO, stdout lines at DEBUG.</p>
 * <p><strong>Observability:</strong> Sets MDC keys {@code run}, {@code stage} and {@code stream} around each event so
 * appenders can route or format per stage. Lines longer than the configured byte budget are truncated.</p>
 * <p><strong>Thread-safety:</strong> Safe; called concurrently from every stream proxy thread.</p>
 *
 * @since 0.1.0
 */
public final class Slf4jStageLogSink implements StageLogSink {
  /** Logger carrying stage output; configure its level to control stage tracing. */
  public static final String LOGGER_NAME = "ca.gc.cra.sluice.stage";
  static final int DEFAULT_MAX_LINE_BYTES = 8192;

  private final Logger logger;
  private final String runId;
  private final int maxLineBytes;

  public Slf4jStageLogSink(String runId) {
    this(runId, DEFAULT_MAX_LINE_BYTES);
  }

  public Slf4jStageLogSink(String runId, int maxLineBytes) {
    this.runId = Objects.requireNonNull(runId, "runId");
    if (maxLineBytes <= 0) {
      throw new IllegalArgumentException("maxLineBytes must be positive");
    }
    this.maxLineBytes = maxLineBytes;
    this.logger = LoggerFactory.getLogger(LOGGER_NAME);
  }

  @Override
  public void accept(String stageId, StreamKind stream, String line) {
    boolean enabled = stream == StreamKind.STDERR ? logger.isInfoEnabled() : logger.isDebugEnabled();
    if (!enabled) {
      return;
    }
    MDC.put("run", runId);
    MDC.put("stage", stageId);
    MDC.put("stream", stream.label());
    try {
      String message = Logs.truncate(line, maxLineBytes);
      if (stream == StreamKind.STDERR) {
        logger.info("[{}] {}", stageId, message);
      } else {
        logger.debug("[{}] {}", stageId, message);
      }
    } finally {
      MDC.remove("stream");
      MDC.remove("stage");
      MDC.remove("run");
    }
  }
}
