package ca.gc.cra.sluice.domain.run;

import ca.gc.cra.sluice.domain.stage.StreamKind;

/**
 * Raised when a stream proxy fails for a reason other than an absorbed downstream write failure.
 *
 * @since 0.1.0
 */
public final class StreamProxyException extends RunnerException {
  private static final long serialVersionUID = 1L;

  private final String stageId;
  private final StreamKind stream;

  /**
   * Creates a proxy failure.
   *
   * @param stageId stage owning the stream
   * @param stream failing stream
   * @param cause read or write failure
   */
  public StreamProxyException(String stageId, StreamKind stream, Throwable cause) {
    super("Output proxy for " + stageId + " " + stream.label() + " failed: "
        + (cause == null ? "unknown" : cause.getMessage()), cause);
    this.stageId = stageId;
    this.stream = stream;
  }

  public String stageId() {
    return stageId;
  }

  public StreamKind stream() {
    return stream;
  }
}
