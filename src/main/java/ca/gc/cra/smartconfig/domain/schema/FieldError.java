package ca.gc.cra.smartconfig.domain.schema;

import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import java.util.Objects;

/**
 * One validation failure.
 *
 * @param path offending field
 * @param kind failure category
 * @param message constraint that was violated; never contains the field value
 * @since 0.1.0
 */
public record FieldError(FieldPath path, FieldErrorKind kind, String message) {

  public FieldError {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }

  /**
   * Renders the error on one line.
   *
   * @return description such as {@code db.port: TYPE_MISMATCH expected number but was string}
   */
  public String describe() {
    return path + ": " + kind + " " + message;
  }
}
