package ca.gc.cra.smartconfig.domain.history;

/**
 * Change type of a field between two snapshots.
 *
 * @since 0.1.0
 */
public enum DeltaKind {
  ADDED,
  REMOVED,
  CHANGED
}
