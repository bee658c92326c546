/**
 * <strong>Purpose:</strong> Input validation helpers shared by configuration and CLI layers.
 * <p><strong>Concurrency:</strong> Stateless utilities; thread-safe.
 * <p><strong>Observability:</strong> No logging; failures raise {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sluice.validation;
