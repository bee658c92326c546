package ca.gc.cra.sluice.infrastructure.output;

import ca.gc.cra.sluice.application.port.StageLogSink;
import ca.gc.cra.sluice.domain.stage.StreamKind;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Objects;

/**
 * Appends stage output to a file as JSON Lines, one object per line with {@code ts}, {@code run}, {@code stage},
 * {@code stream} and {@code line} fields.
 *
 * <p>Writes are synchronized and flushed per event so the file can be tailed during a run. A write failure surfaces
 * as {@link UncheckedIOException}; the stream proxy then stops forwarding to this sink.</p>
 *
 * @since 0.1.0
 */
public final class JsonLinesStageLogSink implements StageLogSink, Closeable {
  private static final JsonFactory FACTORY = new JsonFactory();

  private final Path file;
  private final String runId;
  private final Clock clock;
  private final Writer writer;
  private final JsonGenerator generator;
  private boolean closed;

  public JsonLinesStageLogSink(Path file, String runId) throws IOException {
    this(file, runId, Clock.systemUTC());
  }

  JsonLinesStageLogSink(Path file, String runId, Clock clock) throws IOException {
    this.file = Objects.requireNonNull(file, "file");
    this.runId = Objects.requireNonNull(runId, "runId");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    this.generator = FACTORY.createGenerator(writer);
    this.generator.setRootValueSeparator(null);
  }

  public Path file() {
    return file;
  }

  @Override
  public synchronized void accept(String stageId, StreamKind stream, String line) {
    if (closed) {
      return;
    }
    try {
      generator.writeStartObject();
      generator.writeStringField("ts", clock.instant().toString());
      generator.writeStringField("run", runId);
      generator.writeStringField("stage", stageId);
      generator.writeStringField("stream", stream.label());
      generator.writeStringField("line", line);
      generator.writeEndObject();
      generator.writeRaw('\n');
      generator.flush();
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot append to run log " + file, ex);
    }
  }

  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    try {
      generator.close();
    } finally {
      writer.close();
    }
  }
}
