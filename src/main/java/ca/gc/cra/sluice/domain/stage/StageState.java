package ca.gc.cra.sluice.domain.stage;

/**
 * Lifecycle of a single stage. Transitions only move forward; a stage never restarts.
 *
 * <pre>NOT_STARTED -&gt; RUNNING -&gt; EXITED -&gt; STOPPED</pre>
 *
 * <p>{@code STOPPED} is reached from {@code RUNNING} or {@code EXITED} when the stage is force-stopped.</p>
 *
 * @since 0.1.0
 */
public enum StageState {
  /** Created but no process spawned yet. */
  NOT_STARTED,
  /** Process spawned and alive. */
  RUNNING,
  /** Process terminated on its own. */
  EXITED,
  /** Process killed and resources released by a forced stop. */
  STOPPED;

  /**
   * Checks whether moving to {@code next} keeps the lifecycle one-directional.
   *
   * @param next candidate state
   * @return {@code true} when {@code next} is not earlier than this state
   */
  public boolean canMoveTo(StageState next) {
    return next != null && next.ordinal() >= ordinal();
  }
}
