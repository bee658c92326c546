package ca.gc.cra.sluice.domain.run;

/**
 * Raised when a stage process cannot be spawned. Fatal and never retried.
 *
 * @since 0.1.0
 */
public final class StageStartupException extends RunnerException {
  private static final long serialVersionUID = 1L;

  private final String stageId;

  /**
   * Creates a startup failure.
   *
   * @param stageId stage that failed to start
   * @param cause spawn failure
   */
  public StageStartupException(String stageId, Throwable cause) {
    super("Cannot start stage " + stageId + ": " + (cause == null ? "unknown" : cause.getMessage()), cause);
    this.stageId = stageId;
  }

  /**
   * Stage that failed to start.
   *
   * @return stage id
   */
  public String stageId() {
    return stageId;
  }
}
