package ca.gc.cra.smartconfig.domain.schema;

/**
 * Category of a validation failure.
 *
 * @since 0.1.0
 */
public enum FieldErrorKind {
  MISSING_FIELD,
  TYPE_MISMATCH,
  CONSTRAINT_VIOLATION,
  UNKNOWN_FIELD
}
