package ca.gc.cra.sluice.application.pipeline;

import ca.gc.cra.sluice.application.port.LineLengthLimitException;
import ca.gc.cra.sluice.application.port.Stage;
import ca.gc.cra.sluice.application.port.context.ExecutionContext;
import ca.gc.cra.sluice.domain.run.OutputLimitException;
import ca.gc.cra.sluice.domain.run.RunVerdict;
import ca.gc.cra.sluice.domain.run.RunnerException;
import ca.gc.cra.sluice.domain.run.StreamProxyException;
import ca.gc.cra.sluice.domain.run.UnexpectedSequenceException;
import ca.gc.cra.sluice.domain.stage.StreamKind;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Drives a started, linked {@link Pipeline} to completion and reconciles its exit codes.
 * <p><strong>Why:</strong> Stage processes exit and their streams drain independently; the manager turns those
 * events into one ordered sequence: advance, unwind, or abort.</p>
 * <p><strong>Algorithm:</strong> Starting with the true head as the current head, each step races the stdout and
 * stderr proxies of the stages from the current head to the tail (failure only) against their exits:
 * <ul>
 *   <li>A proxy failure aborts the run. A line-length failure on the head's stdout becomes
 *   {@link OutputLimitException}.</li>
 *   <li>A finished tail records the consumer code. Upstream stages still running are killed in reverse order and the
 *   producer code is taken as {@code 0}, since the producer was pre-empted rather than failing.</li>
 *   <li>A finished current head is drained, the next stage's stdin is closed, and the next stage becomes the current
 *   head. When the next stage is the tail, the tail is drained and awaited.</li>
 *   <li>Any other exit is an out-of-turn intermediate stage; every stage from the current head on is stopped and
 *   {@link UnexpectedSequenceException} is thrown.</li>
 * </ul>
 * Proxy failures seen while draining are classified the same way as failures won in the race.</p>
 * <p><strong>Thread-safety:</strong> Single use, confined to the calling thread.</p>
 *
 * @since 0.1.0
 */
final class ExecutionManager {
  private static final Logger log = LoggerFactory.getLogger(ExecutionManager.class);

  enum Channel {
    EXIT(null),
    STDOUT(StreamKind.STDOUT),
    STDERR(StreamKind.STDERR);

    private final StreamKind stream;

    Channel(StreamKind stream) {
      this.stream = stream;
    }
  }

  record Watch(Stage stage, Channel channel) {}

  private final Pipeline pipeline;
  private final int bufferSize;
  private final int lineLengthLimit;

  private Integer producerCode;
  private Integer consumerCode;

  ExecutionManager(Pipeline pipeline, ExecutionContext context) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.bufferSize = context.bufferSize();
    this.lineLengthLimit = context.lineLengthLimit();
  }

  /**
   * Runs the driving loop until the pipeline drains or fails.
   *
   * @return reconciled verdict; may be a failing one
   * @throws RunnerException on proxy failure, line-length violation or unexpected completion order
   * @throws InterruptedException when the control thread is interrupted
   */
  RunVerdict run() throws RunnerException, InterruptedException {
    if (pipeline.size() == 1) {
      runSingle(pipeline.head());
    } else {
      Stage current = pipeline.head();
      while (current != null && current != pipeline.tail()) {
        current = step(current);
      }
    }
    RunVerdict verdict = RunVerdict.reconcile(producerCode, consumerCode);
    log.debug("Pipeline drained; producer code {}, consumer code {}", verdict.producerCode(),
        verdict.consumerCode());
    return verdict;
  }

  /** Returns the next current head, or {@code null} once the run has concluded. */
  Stage step(Stage current) throws RunnerException, InterruptedException {
    int start = pipeline.indexOf(current);
    List<Stage> remaining = pipeline.from(start);

    CompletionRace<Watch> race = new CompletionRace<>();
    for (Stage stage : remaining) {
      race.onFailure(new Watch(stage, Channel.STDOUT), stage.proxyStdout());
      race.onFailure(new Watch(stage, Channel.STDERR), stage.proxyStderr());
    }
    for (Stage stage : remaining) {
      race.onCompletion(new Watch(stage, Channel.EXIT), stage.waitExit());
    }

    log.debug("Waiting for process completion or output failure from {} onward", current.id());
    CompletionRace.Outcome<Watch> outcome = race.await();
    if (outcome.kind() == CompletionRace.Kind.FAILED) {
      throw classify(outcome.key(), outcome.cause());
    }

    Stage tail = pipeline.tail();
    if (tail.waitExit().isDone()) {
      log.debug("Tail {} completed first", tail.id());
      consumerCode = exitCode(tail);
      completeUpstream();
      return null;
    }
    if (current.waitExit().isDone()) {
      log.debug("Current head {} completed as expected", current.id());
      return handleHeadCompleted(current, start);
    }

    Stage culprit = outcome.key().stage();
    log.warn("Stage {} exited before its upstream; stopping {} and later stages", culprit.id(), current.id());
    stopFrom(start);
    throw new UnexpectedSequenceException(culprit.id());
  }

  Integer producerCode() {
    return producerCode;
  }

  Integer consumerCode() {
    return consumerCode;
  }

  private void runSingle(Stage only) throws RunnerException, InterruptedException {
    CompletionRace.Outcome<Watch> outcome = new CompletionRace<Watch>()
        .onFailure(new Watch(only, Channel.STDOUT), only.proxyStdout())
        .onFailure(new Watch(only, Channel.STDERR), only.proxyStderr())
        .onCompletion(new Watch(only, Channel.EXIT), only.waitExit())
        .await();
    if (outcome.kind() == CompletionRace.Kind.FAILED) {
      throw classify(outcome.key(), outcome.cause());
    }
    int code = exitCode(only);
    drain(only);
    if (only.producer()) {
      producerCode = code;
    } else {
      consumerCode = code;
    }
  }

  private void completeUpstream() throws RunnerException, InterruptedException {
    int tailIndex = pipeline.size() - 1;
    if (pipeline.upstreamComplete(tailIndex)) {
      producerCode = exitCode(pipeline.head());
    } else {
      log.info("Consumer {} finished before its upstream; stopping upstream stages", pipeline.tail().id());
      List<Stage> upstream = pipeline.stages().subList(0, tailIndex);
      for (int i = upstream.size() - 1; i >= 0; i--) {
        upstream.get(i).stop(true);
      }
      producerCode = 0;
    }
    drain(pipeline.tail());
  }

  private Stage handleHeadCompleted(Stage current, int start) throws RunnerException, InterruptedException {
    Stage next = pipeline.stages().get(start + 1);
    if (current == pipeline.head()) {
      producerCode = exitCode(current);
    }
    drain(current);
    try {
      next.closeStdin();
    } catch (IOException ex) {
      log.debug("Closing stdin of {} failed: {}", next.id(), ex.getMessage());
    }
    if (next == pipeline.tail()) {
      log.debug("Tail {} is next; waiting for it to finish", next.id());
      drain(next);
      consumerCode = exitCode(next);
      return null;
    }
    return next;
  }

  private void stopFrom(int start) throws InterruptedException {
    for (Stage stage : pipeline.from(start)) {
      try {
        stage.closeStdin();
      } catch (IOException ex) {
        log.debug("Closing stdin of {} failed: {}", stage.id(), ex.getMessage());
      }
      stage.stop(true);
    }
  }

  private void drain(Stage stage) throws RunnerException, InterruptedException {
    await(new Watch(stage, Channel.STDOUT), stage.proxyStdout());
    await(new Watch(stage, Channel.STDERR), stage.proxyStderr());
  }

  private void await(Watch watch, CompletableFuture<Void> proxy) throws RunnerException, InterruptedException {
    try {
      proxy.get();
    } catch (CancellationException ex) {
      log.debug("{} proxy of {} was cancelled", watch.channel().stream.label(), watch.stage().id());
    } catch (ExecutionException ex) {
      throw classify(watch, ex.getCause());
    }
  }

  private int exitCode(Stage stage) throws RunnerException, InterruptedException {
    try {
      return stage.waitExit().get();
    } catch (ExecutionException ex) {
      throw new RunnerException("Cannot read exit status of stage " + stage.id(),
          CompletionRace.unwrap(ex.getCause()));
    }
  }

  RunnerException classify(Watch watch, Throwable failure) {
    Throwable cause = CompletionRace.unwrap(failure);
    Stage stage = watch.stage();
    if (stage == pipeline.head() && watch.channel() == Channel.STDOUT
        && cause instanceof LineLengthLimitException) {
      log.error("Output line length limit exceeded by {}: limit {} bytes, buffer size {} bytes", stage.id(),
          lineLengthLimit, bufferSize);
      return new OutputLimitException(stage.id(), lineLengthLimit, bufferSize, cause);
    }
    if (cause instanceof RunnerException runnerException) {
      return runnerException;
    }
    StreamKind stream = watch.channel().stream == null ? StreamKind.STDOUT : watch.channel().stream;
    return new StreamProxyException(stage.id(), stream, cause);
  }
}
