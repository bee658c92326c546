/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound forwarded payloads before emission.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sluice.logging;
