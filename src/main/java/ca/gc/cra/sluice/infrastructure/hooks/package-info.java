/**
 * Stage preparation and cleanup hooks.
 */
package ca.gc.cra.sluice.infrastructure.hooks;
