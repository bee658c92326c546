package ca.gc.cra.sluice.infrastructure.process;

import ca.gc.cra.sluice.application.port.OutputSink;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Writes forwarded units into a process's stdin, flushing after each unit so the downstream stage sees it at once.
 *
 * <p>The upstream proxy thread writes while the control thread may close; both paths synchronize on this sink.</p>
 */
final class ProcessInputSink implements OutputSink {
  private final String stageId;
  private final OutputStream stdin;
  private boolean closed;

  ProcessInputSink(String stageId, OutputStream stdin) {
    this.stageId = Objects.requireNonNull(stageId, "stageId");
    this.stdin = Objects.requireNonNull(stdin, "stdin");
  }

  @Override
  public synchronized void write(byte[] line) throws IOException {
    if (closed) {
      throw new IOException("stdin of stage " + stageId + " is closed");
    }
    stdin.write(line);
    stdin.flush();
  }

  /**
   * Closes stdin once; later calls return immediately.
   *
   * @throws IOException when flushing or closing the pipe fails
   */
  synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    stdin.close();
  }
}
