/**
 * Process-backed stages: spawning, stdin forwarding and bounded line proxies over stdout and stderr.
 */
package ca.gc.cra.sluice.infrastructure.process;
