package ca.gc.cra.sluice.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for creating executor services aligned with SLUICE concurrency requirements.
 */
public final class ExecutorFactories {
  private static final long STREAM_THREAD_KEEP_ALIVE_SECONDS = 30L;

  private ExecutorFactories() {}

  /**
   * Builds an unbounded executor for blocking stream proxies.
   *
   * <p>Every stage runs two proxies that block on pipe reads for the whole run, so the pool grows with the pipeline
   * instead of queueing. Threads are daemons so a proxy stuck on a leaked pipe never pins the JVM.</p>
   *
   * @param prefix thread-name prefix used to tag proxy threads
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor service
   */
  public static ExecutorService newStreamPool(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "sluice-io" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        STREAM_THREAD_KEEP_ALIVE_SECONDS,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
