package ca.gc.cra.sluice.domain.run;

import ca.gc.cra.sluice.domain.stage.StageRole;
import java.util.EnumMap;
import java.util.Map;

/**
 * <strong>What:</strong> Final exit-code attribution of a pipeline run.
 * <p><strong>Why:</strong> The head and tail exit statuses are the only codes that decide an orderly run; this record
 * reconciles them exactly once after the driving loop ends.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param producerCode exit status of the pipeline head, or {@code 0} when the head was pre-empted
 * @param consumerCode exit status of the pipeline tail
 * @since 0.1.0
 */
public record RunVerdict(int producerCode, int consumerCode) {

  /** Classification of a reconciled run. */
  public enum Kind {
    SUCCESS("Run completed"),
    EXTRACTOR_FAILURE("Extractor failed"),
    LOADER_FAILURE("Loader failed"),
    COMBINED_FAILURE("Extractor and loader failed");

    private final String description;

    Kind(String description) {
      this.description = description;
    }

    /**
     * Human-readable summary used in exception messages and CLI output.
     *
     * @return short description
     */
    public String description() {
      return description;
    }
  }

  /**
   * Builds a verdict from codes that may never have been recorded.
   *
   * @param producerCode head exit code or {@code null} when unset
   * @param consumerCode tail exit code or {@code null} when unset
   * @return verdict where unset codes count as {@code 0}
   */
  public static RunVerdict reconcile(Integer producerCode, Integer consumerCode) {
    return new RunVerdict(
        producerCode == null ? 0 : producerCode,
        consumerCode == null ? 0 : consumerCode);
  }

  /**
   * Classifies the verdict: both nonzero, producer only, consumer only, or success.
   *
   * @return verdict kind
   */
  public Kind kind() {
    if (producerCode != 0 && consumerCode != 0) {
      return Kind.COMBINED_FAILURE;
    }
    if (producerCode != 0) {
      return Kind.EXTRACTOR_FAILURE;
    }
    if (consumerCode != 0) {
      return Kind.LOADER_FAILURE;
    }
    return Kind.SUCCESS;
  }

  /**
   * Indicates whether both exit codes are zero.
   *
   * @return {@code true} on success
   */
  public boolean success() {
    return kind() == Kind.SUCCESS;
  }

  /**
   * Maps each failing role to its exit code; empty on success.
   *
   * @return role to exit code payload
   */
  public Map<StageRole, Integer> exitCodes() {
    Map<StageRole, Integer> codes = new EnumMap<>(StageRole.class);
    if (producerCode != 0) {
      codes.put(StageRole.EXTRACTOR, producerCode);
    }
    if (consumerCode != 0) {
      codes.put(StageRole.LOADER, consumerCode);
    }
    return Map.copyOf(codes);
  }

  /**
   * Returns this verdict when successful, otherwise raises the matching exit-code failure.
   *
   * @return this verdict
   * @throws ExitCodeFailureException when either code is nonzero
   */
  public RunVerdict requireSuccess() throws ExitCodeFailureException {
    if (!success()) {
      throw new ExitCodeFailureException(this);
    }
    return this;
  }
}
