package ca.gc.cra.sluice.infrastructure.process;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sluice.application.port.LineLengthLimitException;
import ca.gc.cra.sluice.application.port.MetricsPort;
import ca.gc.cra.sluice.application.port.OutputSink;
import ca.gc.cra.sluice.domain.stage.StreamKind;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(10)
class StreamProxyTest {
  private final ExecutorService executor = Executors.newCachedThreadPool();

  @AfterEach
  void shutdown() {
    executor.shutdownNow();
  }

  private static ByteArrayInputStream input(String content) {
    return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void forwardsEveryUnitToEverySinkInOrder() throws Exception {
    ByteArrayOutputStream first = new ByteArrayOutputStream();
    ByteArrayOutputStream second = new ByteArrayOutputStream();
    List<OutputSink> sinks = List.of(first::write, second::write);

    StreamProxy proxy = StreamProxy.start("tap", StreamKind.STDOUT, input("one\ntwo\nthree"), sinks, 64,
        MetricsPort.NO_OP, executor);
    proxy.completion().get(5, TimeUnit.SECONDS);

    assertEquals("one\ntwo\nthree", first.toString(StandardCharsets.UTF_8));
    assertEquals("one\ntwo\nthree", second.toString(StandardCharsets.UTF_8));
  }

  @Test
  void failingSinkIsDroppedAndOthersKeepReceiving() throws Exception {
    AtomicInteger attempts = new AtomicInteger();
    OutputSink broken = line -> {
      attempts.incrementAndGet();
      throw new IOException("Broken pipe");
    };
    ByteArrayOutputStream log = new ByteArrayOutputStream();

    StreamProxy proxy = StreamProxy.start("tap", StreamKind.STDOUT, input("a\nb\nc\n"), List.of(broken, log::write),
        64, MetricsPort.NO_OP, executor);
    proxy.completion().get(5, TimeUnit.SECONDS);

    assertEquals(1, attempts.get());
    assertEquals("a\nb\nc\n", log.toString(StandardCharsets.UTF_8));
  }

  @Test
  void oversizedUnitFailsTheProxy() {
    StreamProxy proxy = StreamProxy.start("tap", StreamKind.STDOUT, input("0123456789\n"), List.of(), 4,
        MetricsPort.NO_OP, executor);

    ExecutionException ex = assertThrows(ExecutionException.class, () -> proxy.completion().get(5, TimeUnit.SECONDS));
    assertInstanceOf(LineLengthLimitException.class, ex.getCause());
  }

  @Test
  void sinkCrashFailsTheProxy() {
    OutputSink crashing = line -> {
      throw new IllegalStateException("bug");
    };
    StreamProxy proxy = StreamProxy.start("tap", StreamKind.STDERR, input("x\n"), List.of(crashing), 4,
        MetricsPort.NO_OP, executor);

    ExecutionException ex = assertThrows(ExecutionException.class, () -> proxy.completion().get(5, TimeUnit.SECONDS));
    assertInstanceOf(IllegalStateException.class, ex.getCause());
  }

  @Test
  void cancelReleasesABlockedRead() throws Exception {
    PipedOutputStream writer = new PipedOutputStream();
    PipedInputStream reader = new PipedInputStream(writer);
    StreamProxy proxy = StreamProxy.start("tap", StreamKind.STDOUT, reader, List.of(), 64, MetricsPort.NO_OP,
        executor);

    proxy.cancel();

    assertTrue(proxy.completion().isCancelled());
    assertThrows(CancellationException.class, () -> proxy.completion().get(5, TimeUnit.SECONDS));
    writer.close();
  }
}
