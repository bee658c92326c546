package ca.gc.cra.sluice.domain.run;

import ca.gc.cra.sluice.domain.stage.StageRole;
import java.util.Map;

/**
 * Raised when an intermediate stage exits before the stages around it, which an orderly run never does.
 *
 * <p>This is a classification, not an exit-code failure. {@link #exitCodes()} returns {@code 1} for both the
 * extractor and the loader only as a failure marker for callers that key on roles; neither value is a real process
 * exit status, and the stages themselves were force-stopped. Use {@link #stageId()} to find the offending stage.</p>
 *
 * @since 0.1.0
 */
public final class UnexpectedSequenceException extends RunnerException {
  private static final long serialVersionUID = 1L;

  private final String stageId;

  /**
   * Creates an unexpected-sequence failure.
   *
   * @param stageId intermediate stage that completed out of turn
   */
  public UnexpectedSequenceException(String stageId) {
    super("Unexpected completion sequence in pipeline. Intermediate stage " + stageId
            + " (likely a mapper) failed.",
        Map.of(StageRole.EXTRACTOR, 1, StageRole.LOADER, 1),
        null);
    this.stageId = stageId;
  }

  /**
   * Intermediate stage that exited out of turn.
   *
   * @return stage id
   */
  public String stageId() {
    return stageId;
  }
}
