package ca.gc.cra.sluice.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Destination for discrete units of stage output forwarded by a stream proxy.
 * <p><strong>Why:</strong> Lets a proxy feed log sinks and the next stage's stdin through one contract.</p>
 * <p><strong>Role:</strong> Domain port implemented by stdin writers and log adapters.</p>
 * <p><strong>Thread-safety:</strong> A sink receives units from a single proxy thread; implementations shared by
 * several proxies must synchronize themselves.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface OutputSink {
  /**
   * Writes one unit of output, typically a line including its terminating newline.
   *
   * @param line raw bytes as read from the stream; must not be retained after the call
   * @throws IOException when the destination is gone; the proxy stops writing to this sink afterwards
   */
  void write(byte[] line) throws IOException;
}
