/**
 * Merge inputs and outputs: sources, policy, conflict records and results.
 */
package ca.gc.cra.smartconfig.domain.merge;
