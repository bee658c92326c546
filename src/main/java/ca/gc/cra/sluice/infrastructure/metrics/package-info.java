/**
 * OpenTelemetry metrics adapter and bootstrap.
 */
package ca.gc.cra.sluice.infrastructure.metrics;
