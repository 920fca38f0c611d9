package ca.gc.cra.smartconfig.domain.merge;

/**
 * Category of a merge conflict.
 *
 * @since 0.1.0
 */
public enum ConflictKind {
  /** Several sources defined the same kind of value with different content. */
  VALUE_CONFLICT,
  /** Sources disagreed on the kind of value at the path. */
  TYPE_CONFLICT
}
