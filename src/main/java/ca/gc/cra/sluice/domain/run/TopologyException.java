package ca.gc.cra.sluice.domain.run;

import java.util.Objects;

/**
 * Raised when a pipeline's shape violates a topology rule. Always detected before any process starts.
 *
 * @since 0.1.0
 */
public final class TopologyException extends RunnerException {
  private static final long serialVersionUID = 1L;

  /** Topology rule that was violated. */
  public enum Rule {
    EMPTY("No stages in pipeline"),
    HEAD_CONSUMES("First stage in pipeline should not be a consumer"),
    TAIL_PRODUCES("Last stage in pipeline should not be a producer"),
    INTERMEDIATE_ROLE("Intermediate stages must be producers and consumers"),
    MISSING_UPSTREAM("Stage requires input but has no upstream producer");

    private final String message;

    Rule(String message) {
      this.message = message;
    }

    /**
     * Default message describing the rule.
     *
     * @return rule description
     */
    public String message() {
      return message;
    }
  }

  private final Rule rule;

  /**
   * Creates a topology failure for a rule.
   *
   * @param rule violated rule
   * @param detail extra context such as the offending stage id; may be {@code null}
   */
  public TopologyException(Rule rule, String detail) {
    super(detail == null ? rule.message() : rule.message() + ": " + detail);
    this.rule = Objects.requireNonNull(rule, "rule");
  }

  /**
   * Rule that failed.
   *
   * @return violated rule
   */
  public Rule rule() {
    return rule;
  }
}
