/**
 * Destinations for stage output lines: SLF4J logging and JSON Lines run logs.
 */
package ca.gc.cra.sluice.infrastructure.output;
