/**
 * <strong>Purpose:</strong> Stage vocabulary: roles, lifecycle states, stream kinds, and resolved descriptors.
 * <p><strong>Concurrency:</strong> Immutable values; safe to share across proxy threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sluice.domain.stage;
