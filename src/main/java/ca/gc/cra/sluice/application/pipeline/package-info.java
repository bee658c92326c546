/**
 * Pipeline topology, linking and the execution manager that arbitrates stage exits against stream failures.
 */
package ca.gc.cra.sluice.application.pipeline;
