package ca.gc.cra.sluice.application.port;

import ca.gc.cra.sluice.application.port.context.ExecutionContext;
import ca.gc.cra.sluice.domain.run.StageStartupException;
import ca.gc.cra.sluice.domain.stage.StageRole;
import ca.gc.cra.sluice.domain.stage.StageState;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * <strong>What:</strong> One pipeline element wrapping an externally spawned process.
 * <p><strong>Why:</strong> The execution manager only needs lifecycle operations, stdio handles, and completion
 * futures; how a process is spawned belongs to adapters.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code ProcessStage}; tests supply in-memory stages.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own the process handle, its stdin writer, and at most one proxy task per output stream.</li>
 *   <li>Memoize the stdout/stderr proxy tasks and the exit future.</li>
 *   <li>Release resources in {@link #post()} on every path.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Lifecycle methods are called from the run's control thread; returned futures
 * complete on proxy or process-reaper threads.</p>
 *
 * @implNote Call order is {@code prepare -> start -> register sinks -> proxy/waitExit -> stop/post}.
 * @since 0.1.0
 */
public interface Stage {
  /**
   * Stable identifier used for logging and correlation.
   *
   * @return stage id
   */
  String id();

  /**
   * Pipeline role of the stage.
   *
   * @return role
   */
  StageRole role();

  /**
   * Whether the stage emits stdout meant for the next stage.
   *
   * @return producer capability
   */
  default boolean producer() {
    return role().producer();
  }

  /**
   * Whether the stage requires stdin from the previous stage.
   *
   * @return consumer capability
   */
  default boolean consumer() {
    return role().consumer();
  }

  /**
   * Current lifecycle state.
   *
   * @return state
   */
  StageState state();

  /**
   * Runs collaborator setup; must complete before {@link #start()}.
   *
   * @param context per-run configuration injected into the stage
   * @throws IOException when preparation fails
   */
  void prepare(ExecutionContext context) throws IOException;

  /**
   * Spawns the process with stdout and stderr captured.
   *
   * @throws StageStartupException when the process cannot be spawned
   * @throws IllegalStateException when the stage was not prepared or already started
   */
  void start() throws StageStartupException;

  /**
   * Sink writing into the process's stdin; valid only after {@link #start()}.
   *
   * @return stdin sink
   * @throws IllegalStateException when the stage is not started
   */
  OutputSink stdin();

  /**
   * Closes stdin and waits for the close to complete, signalling end of input. Idempotent.
   *
   * @throws IOException when the pipe cannot be closed cleanly
   */
  void closeStdin() throws IOException;

  /**
   * Returns the memoized stdout proxy task, creating it on the first call.
   *
   * @return proxy task completing at end-of-file
   * @throws IllegalStateException when the stage is not started
   */
  CompletableFuture<Void> proxyStdout();

  /**
   * Returns the memoized stderr proxy task, creating it on the first call.
   *
   * @return proxy task completing at end-of-file
   * @throws IllegalStateException when the stage is not started
   */
  CompletableFuture<Void> proxyStderr();

  /**
   * Appends a stdout destination.
   *
   * @param sink destination
   * @throws IllegalStateException when the stdout proxy already exists
   */
  void registerStdoutSink(OutputSink sink);

  /**
   * Appends a stderr destination.
   *
   * @param sink destination
   * @throws IllegalStateException when the stderr proxy already exists
   */
  void registerStderrSink(OutputSink sink);

  /**
   * Returns the memoized future yielding the process exit code.
   *
   * @return exit future
   * @throws IllegalStateException when the stage is not started
   */
  CompletableFuture<Integer> waitExit();

  /**
   * Terminates the process, awaits its exit, cancels proxy tasks, and runs {@link #post()}.
   *
   * @param forceKill must be {@code true}; graceful stops are not supported
   * @throws UnsupportedOperationException when a graceful stop is requested
   * @throws InterruptedException when interrupted while awaiting exit
   */
  void stop(boolean forceKill) throws InterruptedException;

  /**
   * Releases the stage's resources and runs collaborator cleanup. Safe to call on every path and more than once.
   */
  void post();
}
