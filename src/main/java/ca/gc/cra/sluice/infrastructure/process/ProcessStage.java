package ca.gc.cra.sluice.infrastructure.process;

import ca.gc.cra.sluice.application.port.MetricsPort;
import ca.gc.cra.sluice.application.port.OutputSink;
import ca.gc.cra.sluice.application.port.Stage;
import ca.gc.cra.sluice.application.port.StageHooks;
import ca.gc.cra.sluice.application.port.context.ExecutionContext;
import ca.gc.cra.sluice.domain.run.StageStartupException;
import ca.gc.cra.sluice.domain.stage.StageDescriptor;
import ca.gc.cra.sluice.domain.stage.StageRole;
import ca.gc.cra.sluice.domain.stage.StageState;
import ca.gc.cra.sluice.domain.stage.StreamKind;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link Stage} backed by an operating-system process with piped stdin, stdout and stderr.
 * <p><strong>Why:</strong> Extractors, mappers and loaders are independent executables that talk line-delimited
 * records over stdio.</p>
 * <p><strong>Role:</strong> Infrastructure adapter driven by the execution manager.</p>
 * <p><strong>Lifecycle:</strong> {@link #prepare(ExecutionContext)} then {@link #start()}; sinks are registered before
 * the first call to {@link #proxyStdout()} or {@link #proxyStderr()}; {@link #stop(boolean)} or {@link #post()}
 * finish the stage. Proxy and exit futures are created once and returned on every later call.</p>
 * <p><strong>Thread-safety:</strong> Lifecycle methods are synchronized; sinks are written from proxy threads.</p>
 *
 * @since 0.1.0
 */
public final class ProcessStage implements Stage {
  private static final Logger log = LoggerFactory.getLogger(ProcessStage.class);

  private final StageDescriptor descriptor;
  private final StageHooks hooks;
  private final Executor proxyExecutor;
  private final List<OutputSink> stdoutSinks = new ArrayList<>();
  private final List<OutputSink> stderrSinks = new ArrayList<>();
  private final AtomicBoolean posted = new AtomicBoolean();

  private ExecutionContext context;
  private Process process;
  private ProcessInputSink stdin;
  private StreamProxy stdoutProxy;
  private StreamProxy stderrProxy;
  private CompletableFuture<Integer> exitFuture;
  private volatile StageState state = StageState.NOT_STARTED;

  /**
   * Creates a stage that has not been started.
   *
   * @param descriptor command and role of the stage
   * @param hooks preparation and cleanup hooks; {@code null} means {@link StageHooks#NONE}
   * @param proxyExecutor executor running the blocking stream proxies
   */
  public ProcessStage(StageDescriptor descriptor, StageHooks hooks, Executor proxyExecutor) {
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    this.hooks = Objects.requireNonNullElse(hooks, StageHooks.NONE);
    this.proxyExecutor = Objects.requireNonNull(proxyExecutor, "proxyExecutor");
  }

  @Override
  public String id() {
    return descriptor.id();
  }

  @Override
  public StageRole role() {
    return descriptor.role();
  }

  @Override
  public StageState state() {
    StageState current = state;
    if (current == StageState.RUNNING && !process.isAlive()) {
      return StageState.EXITED;
    }
    return current;
  }

  @Override
  public synchronized void prepare(ExecutionContext context) throws IOException {
    if (state != StageState.NOT_STARTED) {
      throw new IllegalStateException("Stage " + id() + " is already " + state.name().toLowerCase(Locale.ROOT));
    }
    this.context = Objects.requireNonNull(context, "context");
    hooks.prepare(context);
  }

  @Override
  public synchronized void start() throws StageStartupException {
    requireTransition(StageState.RUNNING);
    if (context == null) {
      throw new IllegalStateException("Stage " + id() + " must be prepared before it is started");
    }
    if (process != null) {
      throw new IllegalStateException("Stage " + id() + " was already started");
    }
    List<String> commandLine = descriptor.commandLine(hooks.arguments());
    ProcessBuilder builder = new ProcessBuilder(commandLine);
    descriptor.workingDirectory().ifPresent(dir -> builder.directory(dir.toFile()));
    builder.environment().putAll(descriptor.environment());
    builder.environment().put("SLUICE_RUN_ID", context.runId());
    builder.environment().put("SLUICE_STAGE_ID", id());
    log.debug("Starting stage {}: {}", id(), commandLine);
    try {
      process = builder.start();
    } catch (IOException | SecurityException | UnsupportedOperationException ex) {
      throw new StageStartupException(id(), ex);
    }
    stdin = new ProcessInputSink(id(), process.getOutputStream());
    moveTo(StageState.RUNNING);
    metrics().increment("stage.started");
    log.info("Started {} stage {} (pid {})", role().label(), id(), process.pid());
    if (!consumer()) {
      closeStdinQuietly();
    }
  }

  @Override
  public synchronized OutputSink stdin() {
    requireStarted("No stdin to write");
    return stdin;
  }

  @Override
  public synchronized void closeStdin() throws IOException {
    if (stdin == null) {
      return;
    }
    stdin.close();
  }

  @Override
  public synchronized CompletableFuture<Void> proxyStdout() {
    requireStarted("No IO to proxy");
    if (stdoutProxy == null) {
      stdoutProxy = StreamProxy.start(id(), StreamKind.STDOUT, process.getInputStream(), stdoutSinks,
          context.lineLengthLimit(), metrics(), proxyExecutor);
    }
    return stdoutProxy.completion();
  }

  @Override
  public synchronized CompletableFuture<Void> proxyStderr() {
    requireStarted("No IO to proxy");
    if (stderrProxy == null) {
      stderrProxy = StreamProxy.start(id(), StreamKind.STDERR, process.getErrorStream(), stderrSinks,
          context.lineLengthLimit(), metrics(), proxyExecutor);
    }
    return stderrProxy.completion();
  }

  @Override
  public synchronized void registerStdoutSink(OutputSink sink) {
    if (stdoutProxy != null) {
      throw new IllegalStateException("IO capture already in flight for " + id() + " stdout");
    }
    stdoutSinks.add(Objects.requireNonNull(sink, "sink"));
  }

  @Override
  public synchronized void registerStderrSink(OutputSink sink) {
    if (stderrProxy != null) {
      throw new IllegalStateException("IO capture already in flight for " + id() + " stderr");
    }
    stderrSinks.add(Objects.requireNonNull(sink, "sink"));
  }

  @Override
  public synchronized CompletableFuture<Integer> waitExit() {
    requireStarted("No process to wait for");
    if (exitFuture == null) {
      exitFuture = process.onExit().thenApply(Process::exitValue);
    }
    return exitFuture;
  }

  @Override
  public void stop(boolean forceKill) throws InterruptedException {
    if (!forceKill) {
      throw new UnsupportedOperationException("Only forced stop is supported");
    }
    Process running;
    synchronized (this) {
      running = process;
    }
    if (running != null) {
      if (running.isAlive()) {
        log.warn("Killing stage {} (pid {})", id(), running.pid());
      }
      running.destroyForcibly();
      running.waitFor();
      synchronized (this) {
        if (stdoutProxy != null) {
          stdoutProxy.cancel();
        }
        if (stderrProxy != null) {
          stderrProxy.cancel();
        }
        if (state != StageState.STOPPED) {
          moveTo(StageState.STOPPED);
          metrics().increment("stage.stopped");
        }
      }
    }
    post();
  }

  @Override
  public void post() {
    if (!posted.compareAndSet(false, true)) {
      return;
    }
    closeStdinQuietly();
    try {
      hooks.cleanup();
    } catch (IOException ex) {
      log.warn("Cleanup of stage {} failed", id(), ex);
    }
  }

  @Override
  public String toString() {
    return "ProcessStage{" + id() + ", " + role().label() + "}";
  }

  private void requireTransition(StageState next) {
    StageState current = state();
    if (!current.canMoveTo(next)) {
      throw new IllegalStateException("Stage " + id() + " cannot move from "
          + current.name().toLowerCase(Locale.ROOT) + " to " + next.name().toLowerCase(Locale.ROOT));
    }
  }

  private void moveTo(StageState next) {
    requireTransition(next);
    state = next;
  }

  private void closeStdinQuietly() {
    try {
      closeStdin();
    } catch (IOException ex) {
      log.debug("Closing stdin of stage {} failed: {}", id(), ex.getMessage());
    }
  }

  private void requireStarted(String message) {
    if (process == null) {
      throw new IllegalStateException(message + ": stage " + id() + " has not been started");
    }
  }

  private MetricsPort metrics() {
    return context == null ? MetricsPort.NO_OP : context.metrics();
  }
}
