package ca.gc.cra.smartconfig.domain.tree;

import java.util.Locale;

/**
 * Discriminator for the variants of {@link ConfigValue}.
 *
 * @since 0.1.0
 */
public enum ValueKind {
  NULL,
  BOOLEAN,
  NUMBER,
  STRING,
  SEQUENCE,
  MAPPING;

  /**
   * Indicates whether the kind is a leaf (not a sequence or mapping).
   *
   * @return {@code true} for null, boolean, number and string kinds
   */
  public boolean isScalar() {
    return this != SEQUENCE && this != MAPPING;
  }

  /**
   * Lower-case label used in schema documents and diagnostics.
   *
   * @return label such as {@code "number"}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a kind from its label, ignoring case.
   *
   * @param label label such as {@code "string"} or {@code "mapping"}
   * @return matching kind
   * @throws IllegalArgumentException when the label is unknown
   */
  public static ValueKind fromLabel(String label) {
    if (label == null || label.isBlank()) {
      throw new IllegalArgumentException("kind label must not be blank");
    }
    String normalized = label.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "null" -> NULL;
      case "boolean", "bool" -> BOOLEAN;
      case "number" -> NUMBER;
      case "string" -> STRING;
      case "sequence", "list", "array" -> SEQUENCE;
      case "mapping", "map", "object", "table" -> MAPPING;
      default -> throw new IllegalArgumentException("Unknown value kind: " + label);
    };
  }
}
