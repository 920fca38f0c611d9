/**
 * Version history model: snapshots and field deltas.
 */
package ca.gc.cra.smartconfig.domain.history;
