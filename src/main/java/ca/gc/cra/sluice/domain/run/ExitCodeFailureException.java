package ca.gc.cra.sluice.domain.run;

import java.util.Objects;

/**
 * Raised after an otherwise orderly run when the head, the tail, or both exited nonzero.
 *
 * @since 0.1.0
 */
public final class ExitCodeFailureException extends RunnerException {
  private static final long serialVersionUID = 1L;

  private final RunVerdict verdict;

  /**
   * Creates a failure from a non-successful verdict.
   *
   * @param verdict reconciled verdict; must not be successful
   * @throws IllegalArgumentException when the verdict is a success
   */
  public ExitCodeFailureException(RunVerdict verdict) {
    super(Objects.requireNonNull(verdict, "verdict").kind().description(), verdict.exitCodes(), null);
    if (verdict.success()) {
      throw new IllegalArgumentException("verdict is successful");
    }
    this.verdict = verdict;
  }

  /**
   * Verdict that caused the failure.
   *
   * @return reconciled verdict
   */
  public RunVerdict verdict() {
    return verdict;
  }

  /**
   * Failure classification.
   *
   * @return extractor, loader, or combined failure
   */
  public RunVerdict.Kind kind() {
    return verdict.kind();
  }
}
