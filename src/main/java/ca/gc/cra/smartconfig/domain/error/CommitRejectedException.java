package ca.gc.cra.smartconfig.domain.error;

import ca.gc.cra.smartconfig.domain.schema.FieldError;
import java.util.List;

/**
 * A commit was refused and no snapshot was written. Carries every validation error found.
 *
 * @since 0.1.0
 */
public final class CommitRejectedException extends ConfigException {
  private final List<FieldError> errors;

  public CommitRejectedException(List<FieldError> errors) {
    super("Commit rejected: " + errors.size() + " validation error(s); first: "
        + (errors.isEmpty() ? "<none>" : errors.get(0).describe()));
    this.errors = List.copyOf(errors);
  }

  public CommitRejectedException(String reason) {
    super("Commit rejected: " + reason);
    this.errors = List.of();
  }

  public List<FieldError> errors() {
    return errors;
  }
}
