package ca.gc.cra.sluice.infrastructure.process;

import ca.gc.cra.sluice.application.port.MetricsPort;
import ca.gc.cra.sluice.application.port.OutputSink;
import ca.gc.cra.sluice.domain.stage.StreamKind;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Task that reads one stage stream to end-of-file and forwards every unit to its sinks.
 * <p><strong>Why:</strong> Output already read from a pipe must reach the log and the next stage even after the
 * owning process has exited, so draining is an explicit task the execution manager can await.</p>
 * <p><strong>Failure modes:</strong>
 * <ul>
 *   <li>A unit longer than the limit completes the task with a
 *   {@link ca.gc.cra.sluice.application.port.LineLengthLimitException}.</li>
 *   <li>A sink that fails to accept a write is dropped; reading continues for the remaining sinks. The downstream
 *   stage's own exit code reports its failure.</li>
 *   <li>Any other read failure completes the task exceptionally, unless the proxy was cancelled.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The pump runs on one executor thread; {@link #cancel()} may be called from the
 * control thread.</p>
 *
 * @since 0.1.0
 */
final class StreamProxy {
  private static final Logger log = LoggerFactory.getLogger(StreamProxy.class);

  private final String stageId;
  private final StreamKind stream;
  private final InputStream input;
  private final List<OutputSink> sinks;
  private final int lineLengthLimit;
  private final MetricsPort metrics;
  private final CompletableFuture<Void> completion = new CompletableFuture<>();
  private volatile boolean cancelled;

  private StreamProxy(
      String stageId,
      StreamKind stream,
      InputStream input,
      List<OutputSink> sinks,
      int lineLengthLimit,
      MetricsPort metrics) {
    this.stageId = Objects.requireNonNull(stageId, "stageId");
    this.stream = Objects.requireNonNull(stream, "stream");
    this.input = Objects.requireNonNull(input, "input");
    this.sinks = new ArrayList<>(Objects.requireNonNull(sinks, "sinks"));
    this.lineLengthLimit = lineLengthLimit;
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Creates a proxy and schedules its pump on {@code executor}.
   *
   * @param stageId owning stage
   * @param stream stream being proxied
   * @param input stream to read until end-of-file
   * @param sinks destinations in forwarding order; copied
   * @param lineLengthLimit maximum unit length in bytes
   * @param metrics metrics port
   * @param executor executor running the blocking pump
   * @return started proxy
   */
  static StreamProxy start(
      String stageId,
      StreamKind stream,
      InputStream input,
      List<OutputSink> sinks,
      int lineLengthLimit,
      MetricsPort metrics,
      Executor executor) {
    StreamProxy proxy = new StreamProxy(stageId, stream, input, sinks, lineLengthLimit, metrics);
    executor.execute(proxy::pump);
    return proxy;
  }

  /**
   * Task completing normally at end-of-file, exceptionally on failure, or cancelled by {@link #cancel()}.
   *
   * @return completion future; always the same instance
   */
  CompletableFuture<Void> completion() {
    return completion;
  }

  /**
   * Cancels the task and closes the stream so a blocked read returns.
   */
  void cancel() {
    cancelled = true;
    if (completion.cancel(false)) {
      log.debug("Cancelled {} proxy for stage {}", stream.label(), stageId);
    }
    try {
      input.close();
    } catch (IOException ex) {
      log.debug("Closing {} of stage {} after cancel failed", stream.label(), stageId, ex);
    }
  }

  private void pump() {
    long lines = 0;
    try (InputStream in = input) {
      BoundedLineReader reader = new BoundedLineReader(in, lineLengthLimit);
      byte[] line;
      while ((line = reader.readLine()) != null) {
        lines++;
        forward(line);
      }
      completion.complete(null);
    } catch (IOException ex) {
      if (cancelled) {
        log.debug("{} proxy for stage {} stopped after cancel: {}", stream.label(), stageId, ex.getMessage());
        completion.cancel(false);
      } else {
        log.debug("{} proxy for stage {} failed", stream.label(), stageId, ex);
        completion.completeExceptionally(ex);
      }
    } catch (RuntimeException ex) {
      log.error("{} proxy for stage {} crashed", stream.label(), stageId, ex);
      completion.completeExceptionally(ex);
    } finally {
      metrics.observe("stage.output.lines", lines);
    }
  }

  private void forward(byte[] line) {
    Iterator<OutputSink> iterator = sinks.iterator();
    while (iterator.hasNext()) {
      OutputSink sink = iterator.next();
      try {
        sink.write(line);
      } catch (IOException ex) {
        log.debug("Downstream of stage {} {} is gone ({}); no longer forwarding to it",
            stageId, stream.label(), ex.getMessage());
        iterator.remove();
      }
    }
  }
}
