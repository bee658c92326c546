package ca.gc.cra.sluice.infrastructure.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.sluice.application.port.StageLogSink;
import ca.gc.cra.sluice.domain.stage.StreamKind;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class CompositeStageLogSinkTest {
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(CompositeStageLogSink.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
  }

  @Test
  void singleSinkIsReturnedUnchanged() {
    StageLogSink only = (stageId, stream, line) -> { };

    assertSame(only, CompositeStageLogSink.of(List.of(only)));
    assertSame(StageLogSink.NO_OP, CompositeStageLogSink.of(List.of()));
  }

  @Test
  void failingDelegateDoesNotSilenceTheOthers() {
    List<String> console = new CopyOnWriteArrayList<>();
    AtomicInteger runLogCalls = new AtomicInteger();
    StageLogSink recording = (stageId, stream, line) -> console.add(line);
    StageLogSink fullDisk = (stageId, stream, line) -> {
      runLogCalls.incrementAndGet();
      throw new UncheckedIOException(new IOException("No space left on device"));
    };
    StageLogSink sink = CompositeStageLogSink.of(List.of(fullDisk, recording));

    sink.accept("tap", StreamKind.STDERR, "one");
    sink.accept("tap", StreamKind.STDERR, "two");
    sink.accept("tap", StreamKind.STDERR, "three");

    assertEquals(List.of("one", "two", "three"), console);
    assertEquals(1, runLogCalls.get(), "failed delegate is skipped afterwards");
    List<ILoggingEvent> warnings = appender.list.stream()
        .filter(event -> event.getLevel() == Level.WARN)
        .toList();
    assertEquals(1, warnings.size());
    assertEquals(UncheckedIOException.class.getName(), warnings.get(0).getThrowableProxy().getClassName());
  }
}
