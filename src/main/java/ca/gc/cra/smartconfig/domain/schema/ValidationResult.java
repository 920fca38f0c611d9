package ca.gc.cra.smartconfig.domain.schema;

import java.util.List;

/**
 * Complete list of validation failures for one tree.
 *
 * @param errors every failure found, in tree order
 * @since 0.1.0
 */
public record ValidationResult(List<FieldError> errors) {
  public static final ValidationResult OK = new ValidationResult(List.of());

  public ValidationResult {
    errors = List.copyOf(errors);
  }

  /**
   * Indicates whether the tree satisfied the schema.
   *
   * @return {@code true} when no errors were found
   */
  public boolean ok() {
    return errors.isEmpty();
  }
}
