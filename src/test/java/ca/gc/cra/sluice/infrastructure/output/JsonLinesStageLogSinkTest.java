package ca.gc.cra.sluice.infrastructure.output;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.sluice.domain.stage.StreamKind;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonLinesStageLogSinkTest {
  @TempDir Path tempDir;

  private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

  @Test
  void writesOneJsonObjectPerLine() throws Exception {
    Path file = tempDir.resolve("run.jsonl");
    try (JsonLinesStageLogSink sink = new JsonLinesStageLogSink(file, "r1", clock)) {
      sink.accept("tap", StreamKind.STDERR, "starting \"sync\"");
      sink.accept("target", StreamKind.STDOUT, "{\"n\":1}");
    }

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(List.of(
        "{\"ts\":\"2024-05-01T12:00:00Z\",\"run\":\"r1\",\"stage\":\"tap\",\"stream\":\"stderr\","
            + "\"line\":\"starting \\\"sync\\\"\"}",
        "{\"ts\":\"2024-05-01T12:00:00Z\",\"run\":\"r1\",\"stage\":\"target\",\"stream\":\"stdout\","
            + "\"line\":\"{\\\"n\\\":1}\"}"), lines);
  }

  @Test
  void appendsToExistingFileAndIgnoresWritesAfterClose() throws Exception {
    Path file = tempDir.resolve("run.jsonl");
    Files.writeString(file, "{\"earlier\":true}\n");

    JsonLinesStageLogSink sink = new JsonLinesStageLogSink(file, "r2", clock);
    sink.accept("tap", StreamKind.STDERR, "one");
    sink.close();
    sink.close();
    sink.accept("tap", StreamKind.STDERR, "two");

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    assertEquals("{\"earlier\":true}", lines.get(0));
    assertEquals(file, sink.file());
  }
}
