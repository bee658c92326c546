package ca.gc.cra.sluice.application.port;

import ca.gc.cra.sluice.domain.stage.StreamKind;

/**
 * <strong>What:</strong> Logging collaborator receiving every line a stage writes to a captured stream.
 * <p><strong>Why:</strong> Per-line events are emitted continuously for observability, independent of the verdict.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code Slf4jStageLogSink} and {@code JsonLinesStageLogSink}.</p>
 * <p><strong>Thread-safety:</strong> Invoked concurrently from several proxy threads; implementations must be
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface StageLogSink {
  /**
   * Accepts one decoded line.
   *
   * @param stageId stage that produced the line
   * @param stream stream the line was read from
   * @param line line content without its trailing newline
   */
  void accept(String stageId, StreamKind stream, String line);

  /** Sink that drops every line. */
  StageLogSink NO_OP = (stageId, stream, line) -> {};
}
