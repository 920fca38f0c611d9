package ca.gc.cra.smartconfig.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through CLI arguments and settings files.
 * <p><strong>Role:</strong> Support utilities invoked before adapters touch the filesystem or the vault.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Split comma-separated settings such as {@code secretSuffixes} into clean lists.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank and free of control characters.
   *
   * @param name logical parameter name for diagnostics; {@code "value"} when {@code null}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Splits a comma-separated list, dropping blank items.
   *
   * @param name logical parameter name for diagnostics
   * @param raw list text; {@code null} or blank yields an empty list
   * @return trimmed, non-blank items in input order
   * @throws IllegalArgumentException if an item contains control characters
   */
  public static List<String> splitList(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    List<String> items = new ArrayList<>();
    for (String part : raw.split(",")) {
      if (part.isBlank()) {
        continue;
      }
      items.add(requireNonBlank(name, part));
    }
    return List.copyOf(items);
  }

  /**
   * Returns the trimmed value, or {@code null} when it is {@code null} or blank.
   *
   * @param value candidate text
   * @return trimmed text or {@code null}
   */
  public static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String detail) {
    return (name == null || name.isBlank() ? "value" : name) + " " + detail;
  }
}
