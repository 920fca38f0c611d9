package ca.gc.cra.smartconfig.domain.merge;

import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import java.util.List;
import java.util.Objects;

/**
 * Records that several sources defined a field and which one won. Holds no values, so records are safe to
 * log even for sensitive fields.
 *
 * @param path conflicting field
 * @param sources contributing sources, lowest precedence first
 * @param winner source whose value was kept
 * @param kind conflict category
 * @since 0.1.0
 */
public record ConflictRecord(FieldPath path, List<String> sources, String winner, ConflictKind kind) {

  public ConflictRecord {
    Objects.requireNonNull(path, "path");
    sources = List.copyOf(sources);
    Objects.requireNonNull(winner, "winner");
    Objects.requireNonNull(kind, "kind");
  }

  /**
   * Human readable one-line summary.
   *
   * @return description such as {@code db.host: VALUE_CONFLICT between [a, b]; kept b}
   */
  public String describe() {
    return path + ": " + kind + " between " + sources + "; kept " + winner;
  }
}
