/**
 * Ports between the pipeline engine and its collaborators: stages, output sinks, log sinks, hooks, and metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sluice.application.port;
