package ca.gc.cra.sluice.api;

/**
 * Process exit codes returned by the SLUICE CLI.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Pipeline completed and both extractor and loader exited 0. */
  SUCCESS(0),
  /** Arguments could not be parsed or failed validation. */
  INVALID_ARGS(2),
  /** A file needed by the run could not be read or written. */
  IO_ERROR(3),
  /** The YAML definition or pipeline topology is invalid. */
  CONFIG_ERROR(4),
  /** The run aborted: a stage failed to start, overflowed the line limit, or exited out of order. */
  RUNTIME_FAILURE(5),
  /** The extractor, the loader, or both exited non-zero. */
  EXTRACT_LOAD_FAILURE(6),
  /** The run was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
