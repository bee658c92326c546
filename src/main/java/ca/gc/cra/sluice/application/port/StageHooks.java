package ca.gc.cra.sluice.application.port;

import ca.gc.cra.sluice.application.port.context.ExecutionContext;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Collaborator-owned setup and teardown around one stage's process.
 * <p><strong>Why:</strong> Stages often need configuration or credentials materialized before spawning and removed
 * afterwards, whatever way the run ends.</p>
 * <p><strong>Role:</strong> Domain port invoked at a stage's {@code prepare} and {@code post} boundaries.</p>
 * <p><strong>Thread-safety:</strong> Called from the run's control thread only.</p>
 *
 * @since 0.1.0
 */
public interface StageHooks {
  /**
   * Performs side-effecting setup before the process starts.
   *
   * @param context per-run configuration
   * @throws IOException when setup cannot complete
   */
  default void prepare(ExecutionContext context) throws IOException {}

  /**
   * Extra command-line arguments produced by {@link #prepare(ExecutionContext)}.
   *
   * @return arguments appended to the stage command; empty by default
   */
  default List<String> arguments() {
    return List.of();
  }

  /**
   * Releases whatever {@link #prepare(ExecutionContext)} created. Must tolerate repeated calls.
   *
   * @throws IOException when teardown fails
   */
  default void cleanup() throws IOException {}

  /** Hooks that do nothing. */
  StageHooks NONE = new StageHooks() {};
}
