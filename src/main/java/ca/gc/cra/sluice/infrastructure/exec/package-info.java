/**
 * Executor factories for stream proxy worker pools.
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 * <p><strong>Security:</strong> Thread names carry only the configured prefix and an index.</p>
 */
package ca.gc.cra.sluice.infrastructure.exec;
