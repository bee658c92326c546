package ca.gc.cra.sluice.domain.run;

/**
 * Raised when the pipeline head emits a single output line longer than the configured limit.
 *
 * @since 0.1.0
 */
public final class OutputLimitException extends RunnerException {
  private static final long serialVersionUID = 1L;

  private final String stageId;
  private final int lineLengthLimit;
  private final int bufferSize;

  /**
   * Creates an output limit failure.
   *
   * @param stageId producing stage
   * @param lineLengthLimit maximum accepted line length in bytes
   * @param bufferSize configured stream buffer size the limit derives from
   * @param cause raw limit violation raised by the stream proxy
   */
  public OutputLimitException(String stageId, int lineLengthLimit, int bufferSize, Throwable cause) {
    super("Output line length limit exceeded for stage " + stageId
        + " (line_length_limit=" + lineLengthLimit + ", stream_buffer_size=" + bufferSize
        + "); raise bufferSize to accept larger messages", cause);
    this.stageId = stageId;
    this.lineLengthLimit = lineLengthLimit;
    this.bufferSize = bufferSize;
  }

  /**
   * Stage whose output exceeded the limit.
   *
   * @return stage id
   */
  public String stageId() {
    return stageId;
  }

  /**
   * Limit that was exceeded, in bytes.
   *
   * @return line length limit
   */
  public int lineLengthLimit() {
    return lineLengthLimit;
  }

  /**
   * Configured buffer size in bytes.
   *
   * @return stream buffer size
   */
  public int bufferSize() {
    return bufferSize;
  }
}
