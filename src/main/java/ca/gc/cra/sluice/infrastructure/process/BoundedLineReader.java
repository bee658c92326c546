package ca.gc.cra.sluice.infrastructure.process;

import ca.gc.cra.sluice.application.port.LineLengthLimitException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Splits a byte stream into newline-terminated units, refusing any unit longer than a fixed limit.
 *
 * <p>Returned units keep their terminating {@code \n} so forwarding them reproduces the stream byte for byte. The
 * final unit may lack a terminator when the stream ends mid-line. Not thread-safe.</p>
 */
final class BoundedLineReader {
  private static final int CHUNK_SIZE = 8192;

  private final InputStream input;
  private final int limit;
  private final byte[] chunk = new byte[CHUNK_SIZE];
  private int position;
  private int length;
  private boolean eof;

  BoundedLineReader(InputStream input, int limit) {
    this.input = Objects.requireNonNull(input, "input");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    this.limit = limit;
  }

  /**
   * Reads the next unit.
   *
   * @return unit bytes including the trailing newline when present, or {@code null} at end of stream
   * @throws LineLengthLimitException when a unit, excluding its newline, exceeds the limit
   * @throws IOException when the underlying read fails
   */
  byte[] readLine() throws IOException {
    ByteArrayOutputStream line = null;
    while (true) {
      if (position == length) {
        if (eof || !fill()) {
          return line == null || line.size() == 0 ? null : line.toByteArray();
        }
      }
      int start = position;
      while (position < length && chunk[position] != '\n') {
        position++;
      }
      boolean terminated = position < length;
      if (terminated) {
        position++;
      }
      int count = position - start;
      int buffered = line == null ? 0 : line.size();
      int contentLength = buffered + count - (terminated ? 1 : 0);
      if (contentLength > limit) {
        throw new LineLengthLimitException(limit);
      }
      if (line == null) {
        line = new ByteArrayOutputStream(Math.min(Math.max(count, 128), limit + 1));
      }
      line.write(chunk, start, count);
      if (terminated) {
        return line.toByteArray();
      }
    }
  }

  private boolean fill() throws IOException {
    int read = input.read(chunk, 0, chunk.length);
    position = 0;
    if (read < 0) {
      length = 0;
      eof = true;
      return false;
    }
    length = read;
    return true;
  }
}
