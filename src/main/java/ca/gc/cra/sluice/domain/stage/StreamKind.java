package ca.gc.cra.sluice.domain.stage;

import java.util.Locale;

/**
 * Output stream of a stage process.
 *
 * @since 0.1.0
 */
public enum StreamKind {
  STDOUT,
  STDERR;

  /**
   * Lower-case label used in MDC values and JSON log records.
   *
   * @return {@code stdout} or {@code stderr}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
