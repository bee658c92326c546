package ca.gc.cra.sluice.application.pipeline;

import ca.gc.cra.sluice.application.port.MetricsPort;
import ca.gc.cra.sluice.application.port.Stage;
import ca.gc.cra.sluice.application.port.StageLogSink;
import ca.gc.cra.sluice.application.port.context.ExecutionContext;
import ca.gc.cra.sluice.domain.run.ExitCodeFailureException;
import ca.gc.cra.sluice.domain.run.OutputLimitException;
import ca.gc.cra.sluice.domain.run.RunVerdict;
import ca.gc.cra.sluice.domain.run.RunnerException;
import ca.gc.cra.sluice.domain.run.StageStartupException;
import ca.gc.cra.sluice.domain.run.StreamProxyException;
import ca.gc.cra.sluice.domain.run.TopologyException;
import ca.gc.cra.sluice.domain.run.UnexpectedSequenceException;
import ca.gc.cra.sluice.domain.stage.StageState;
import ca.gc.cra.sluice.domain.stage.StreamKind;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Ordered, immutable chain of {@link Stage}s whose stdout feeds the next stage's stdin.
 * <p><strong>Why:</strong> Gives a linear extract, map, load run explicit topology checks, wiring, lifecycle and a
 * single reconciled verdict.</p>
 * <p><strong>Topology rules:</strong>
 * <ol>
 *   <li>The head must not consume input.</li>
 *   <li>The tail must not produce output, unless it is the only stage.</li>
 *   <li>Every intermediate stage must both produce and consume.</li>
 *   <li>At link time, every consumer must follow a producer.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> A pipeline runs once; concurrent or repeated runs are rejected.</p>
 *
 * @since 0.1.0
 */
public final class Pipeline {
  private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

  private final List<Stage> stages;
  private final AtomicBoolean used = new AtomicBoolean();

  private Pipeline(List<Stage> stages) {
    this.stages = stages;
  }

  /**
   * Creates a pipeline over the given stages in order.
   *
   * @param stages stages, head first; may be empty, in which case {@link #validate()} fails
   * @return pipeline
   */
  public static Pipeline of(List<? extends Stage> stages) {
    Objects.requireNonNull(stages, "stages");
    List<Stage> copy = new ArrayList<>(stages.size());
    for (Stage stage : stages) {
      copy.add(Objects.requireNonNull(stage, "stage"));
    }
    return new Pipeline(List.copyOf(copy));
  }

  public List<Stage> stages() {
    return stages;
  }

  public int size() {
    return stages.size();
  }

  public Stage head() {
    requireStages();
    return stages.get(0);
  }

  public Stage tail() {
    requireStages();
    return stages.get(stages.size() - 1);
  }

  /** Stages strictly between head and tail. */
  public List<Stage> intermediate() {
    if (stages.size() <= 2) {
      return List.of();
    }
    return stages.subList(1, stages.size() - 1);
  }

  /** Stages from {@code index} to the tail, inclusive. */
  public List<Stage> from(int index) {
    return stages.subList(index, stages.size());
  }

  /**
   * Position of a stage by identity.
   *
   * @throws IllegalArgumentException when the stage is not part of this pipeline
   */
  public int indexOf(Stage stage) {
    for (int i = 0; i < stages.size(); i++) {
      if (stages.get(i) == stage) {
        return i;
      }
    }
    throw new IllegalArgumentException("stage is not part of this pipeline: " + stage);
  }

  /** Whether every stage before {@code index} has exited. */
  public boolean upstreamComplete(int index) {
    for (int i = 0; i < index && i < stages.size(); i++) {
      if (!stages.get(i).waitExit().isDone()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Checks the shape rules that do not need started stages.
   *
   * @throws TopologyException naming the first violated rule
   */
  public void validate() throws TopologyException {
    if (stages.isEmpty()) {
      throw new TopologyException(TopologyException.Rule.EMPTY, null);
    }
    if (head().consumer()) {
      throw new TopologyException(TopologyException.Rule.HEAD_CONSUMES, head().id());
    }
    if (stages.size() > 1 && tail().producer()) {
      throw new TopologyException(TopologyException.Rule.TAIL_PRODUCES, tail().id());
    }
    for (Stage stage : intermediate()) {
      if (!stage.producer() || !stage.consumer()) {
        throw new TopologyException(TopologyException.Rule.INTERMEDIATE_ROLE,
            stage.id() + " is a " + stage.role().label());
      }
    }
  }

  /**
   * Registers log sinks on every stage and connects each consumer to its upstream producer.
   *
   * @param logSink destination for stage log lines
   * @param traceStdout whether stdout lines are also logged
   * @throws TopologyException when a consumer has no upstream producer
   */
  public void link(StageLogSink logSink, boolean traceStdout) throws TopologyException {
    StageLogSink sink = Objects.requireNonNullElse(logSink, StageLogSink.NO_OP);
    for (int i = 0; i < stages.size(); i++) {
      Stage stage = stages.get(i);
      if (traceStdout) {
        stage.registerStdoutSink(new LogLineSink(sink, stage.id(), StreamKind.STDOUT));
      }
      stage.registerStderrSink(new LogLineSink(sink, stage.id(), StreamKind.STDERR));
      if (stage.consumer()) {
        if (i == 0 || !stages.get(i - 1).producer()) {
          throw new TopologyException(TopologyException.Rule.MISSING_UPSTREAM, stage.id());
        }
        stages.get(i - 1).registerStdoutSink(stage.stdin());
      }
    }
  }

  /**
   * Validates, starts, links and drives the pipeline, then releases every stage.
   *
   * <p>When the run aborts with anything other than an exit-code failure, stages that are still running or
   * draining are force-stopped, in reverse order, before any stage is posted.</p>
   *
   * @param context run configuration injected into every stage
   * @return successful verdict
   * @throws ExitCodeFailureException when the extractor, the loader, or both exited non-zero
   * @throws RunnerException for topology, startup, output limit, stream or sequencing failures
   * @throws InterruptedException when the calling thread is interrupted
   * @throws IllegalStateException when the pipeline has already been run
   */
  public RunVerdict run(ExecutionContext context) throws RunnerException, InterruptedException {
    Objects.requireNonNull(context, "context");
    if (!used.compareAndSet(false, true)) {
      throw new IllegalStateException("Pipeline has already been run");
    }
    MetricsPort metrics = context.metrics();
    String previousRun = MDC.get("run");
    MDC.put("run", context.runId());
    long startedAt = System.nanoTime();
    try {
      validate();
      try {
        startStages(context);
        try {
          link(context.logSink(), context.traceStdout());
          RunVerdict verdict = new ExecutionManager(this, context).run();
          metrics.increment("run.verdict." + verdict.kind().name().toLowerCase(Locale.ROOT));
          if (verdict.success()) {
            log.info("{} with {} stages", verdict.kind().description(), stages.size());
          } else {
            log.error("{}: {}", verdict.kind().description(), verdict.exitCodes());
          }
          return verdict.requireSuccess();
        } catch (ExitCodeFailureException ex) {
          throw ex;
        } catch (RunnerException ex) {
          stopUnfinished(ex);
          throw ex;
        }
      } finally {
        cleanup();
      }
    } catch (RunnerException ex) {
      metrics.increment("run.failure." + failureKey(ex));
      throw ex;
    } finally {
      metrics.observe("run.duration.millis", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
      if (previousRun == null) {
        MDC.remove("run");
      } else {
        MDC.put("run", previousRun);
      }
    }
  }

  /**
   * Force-stops every started stage.
   *
   * @param graceful must be {@code false}; graceful termination is not supported
   * @throws UnsupportedOperationException when {@code graceful} is requested
   * @throws InterruptedException when interrupted while waiting for a stage to die
   */
  public void terminate(boolean graceful) throws InterruptedException {
    if (graceful) {
      throw new UnsupportedOperationException("Graceful termination is not supported");
    }
    for (Stage stage : stages) {
      if (stage.state() != StageState.NOT_STARTED) {
        stage.stop(true);
      }
    }
  }

  private void startStages(ExecutionContext context) throws StageStartupException, InterruptedException {
    for (int i = 0; i < stages.size(); i++) {
      Stage stage = stages.get(i);
      try {
        stage.prepare(context);
        stage.start();
      } catch (IOException | StageStartupException ex) {
        StageStartupException failure = ex instanceof StageStartupException startup
            ? startup
            : new StageStartupException(stage.id(), ex);
        log.error("Stage {} failed to start; stopping {} started stages", stage.id(), i, failure);
        for (int j = i - 1; j >= 0; j--) {
          stages.get(j).stop(true);
        }
        throw failure;
      }
    }
  }

  private void stopUnfinished(RunnerException failure) {
    for (int i = stages.size() - 1; i >= 0; i--) {
      Stage stage = stages.get(i);
      StageState state = stage.state();
      if (state == StageState.NOT_STARTED || state == StageState.STOPPED) {
        continue;
      }
      try {
        stage.stop(true);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        failure.addSuppressed(ex);
        return;
      }
    }
  }

  private void cleanup() {
    for (Stage stage : stages) {
      stage.post();
    }
  }

  private void requireStages() {
    if (stages.isEmpty()) {
      throw new IllegalStateException("pipeline has no stages");
    }
  }

  static String failureKey(RunnerException ex) {
    if (ex instanceof TopologyException) {
      return "topology";
    }
    if (ex instanceof StageStartupException) {
      return "startup";
    }
    if (ex instanceof OutputLimitException) {
      return "output_limit";
    }
    if (ex instanceof UnexpectedSequenceException) {
      return "unexpected_sequence";
    }
    if (ex instanceof StreamProxyException) {
      return "stream";
    }
    if (ex instanceof ExitCodeFailureException) {
      return "exit_code";
    }
    return "runner";
  }
}
