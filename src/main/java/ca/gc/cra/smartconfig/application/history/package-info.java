/**
 * Snapshot history: commit, listing, diff, rollback and prune over a {@link
 * ca.gc.cra.smartconfig.application.port.HistoryStorePort}.
 */
package ca.gc.cra.smartconfig.application.history;
