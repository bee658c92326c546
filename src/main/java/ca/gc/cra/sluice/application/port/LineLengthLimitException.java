package ca.gc.cra.sluice.application.port;

import java.io.IOException;

/**
 * Raised by a stream proxy when one unit of output is longer than the configured line length limit.
 *
 * @since 0.1.0
 */
public final class LineLengthLimitException extends IOException {
  private static final long serialVersionUID = 1L;

  private final int limit;

  /**
   * Creates a limit violation.
   *
   * @param limit maximum accepted unit length in bytes
   */
  public LineLengthLimitException(int limit) {
    super("Separator is not found, and chunk exceeds the limit of " + limit + " bytes");
    this.limit = limit;
  }

  /**
   * Limit that was exceeded.
   *
   * @return limit in bytes
   */
  public int limit() {
    return limit;
  }
}
