package ca.gc.cra.sluice.domain.run;

import ca.gc.cra.sluice.domain.stage.StageRole;
import java.util.Map;

/**
 * Base class for every terminal failure of a pipeline run.
 *
 * <p>None of these failures are retried by the engine; callers decide whether to re-run.</p>
 *
 * @since 0.1.0
 */
public class RunnerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient Map<StageRole, Integer> exitCodes;

  /**
   * Creates a failure without exit-code payload.
   *
   * @param message description
   */
  public RunnerException(String message) {
    this(message, Map.of(), null);
  }

  /**
   * Creates a failure wrapping a cause.
   *
   * @param message description
   * @param cause underlying failure
   */
  public RunnerException(String message, Throwable cause) {
    this(message, Map.of(), cause);
  }

  /**
   * Creates a failure carrying role-attributed exit codes.
   *
   * @param message description
   * @param exitCodes role to exit code payload; copied
   * @param cause underlying failure, may be {@code null}
   */
  public RunnerException(String message, Map<StageRole, Integer> exitCodes, Throwable cause) {
    super(message, cause);
    this.exitCodes = exitCodes == null ? Map.of() : Map.copyOf(exitCodes);
  }

  /**
   * Structured payload mapping stage roles to exit codes; empty for classifications without codes.
   *
   * @return immutable map
   */
  public Map<StageRole, Integer> exitCodes() {
    return exitCodes;
  }
}
