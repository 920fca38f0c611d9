package ca.gc.cra.smartconfig.domain.history;

import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import java.util.Objects;

/**
 * Field-level difference between two trees.
 *
 * <p>For sensitive fields {@code before} and {@code after} are always {@code null} and {@code redacted} is set;
 * only the fact that the field changed is reported.</p>
 *
 * @param path changed field
 * @param kind change type
 * @param before value in the older tree, {@code null} when added or redacted
 * @param after value in the newer tree, {@code null} when removed or redacted
 * @param redacted whether values were withheld because the field is sensitive
 * @since 0.1.0
 */
public record FieldDelta(FieldPath path, DeltaKind kind, ConfigValue before, ConfigValue after, boolean redacted) {
  private static final String REDACTED = "[REDACTED]";

  public FieldDelta {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(kind, "kind");
  }

  /**
   * Renders the delta on one line.
   *
   * @return description such as {@code ~ db.host: "a" -> "b"}
   */
  public String render() {
    String marker = switch (kind) {
      case ADDED -> "+";
      case REMOVED -> "-";
      case CHANGED -> "~";
    };
    String detail = switch (kind) {
      case ADDED -> show(after);
      case REMOVED -> show(before);
      case CHANGED -> redacted ? "changed" : show(before) + " -> " + show(after);
    };
    return marker + " " + path + ": " + detail;
  }

  private String show(ConfigValue value) {
    if (redacted) {
      return REDACTED;
    }
    return value == null ? "<absent>" : value.isString() ? "\"" + value + "\"" : String.valueOf(value);
  }
}
