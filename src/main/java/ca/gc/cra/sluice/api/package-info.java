/**
 * Command-line entry points for SLUICE.
 */
package ca.gc.cra.sluice.api;
