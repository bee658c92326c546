/**
 * <strong>Purpose:</strong> Run verdicts and the failure taxonomy surfaced to callers of a pipeline run.
 * <p><strong>Pipeline role:</strong> Terminal results; nothing here is retried internally.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sluice.domain.run;
