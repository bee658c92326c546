/**
 * Run configuration: YAML loading, CLI merging, validated settings and the composition root.
 */
package ca.gc.cra.sluice.config;
