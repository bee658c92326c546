package ca.gc.cra.sluice.application.pipeline;

import ca.gc.cra.sluice.application.port.OutputSink;
import ca.gc.cra.sluice.application.port.StageLogSink;
import ca.gc.cra.sluice.domain.stage.StreamKind;
import ca.gc.cra.sluice.logging.Logs;
import java.io.IOException;
import java.io.UncheckedIOException;

/** Adapts a {@link StageLogSink} to the byte-oriented {@link OutputSink} a stream proxy writes to. */
record LogLineSink(StageLogSink logSink, String stageId, StreamKind stream) implements OutputSink {
  @Override
  public void write(byte[] line) throws IOException {
    try {
      logSink.accept(stageId, stream, Logs.decodeLine(line));
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    }
  }
}
