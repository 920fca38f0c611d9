package ca.gc.cra.smartconfig.domain.secret;

import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Identifies fields whose string values must be stored encrypted.
 *
 * <p>A field is sensitive when any of the following holds, ignoring sequence indices:</p>
 * <ul>
 *   <li>its key path matches one of {@code paths}; a {@code *} segment matches any single key;</li>
 *   <li>its leaf key equals one of {@code keyNames};</li>
 *   <li>its leaf key ends with one of {@code suffixes} (for example {@code _secret}).</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class SensitiveFieldMarker {
  /** Default naming convention. */
  public static final String DEFAULT_SUFFIX = "_secret";

  private static final SensitiveFieldMarker NONE = new SensitiveFieldMarker(List.of(), Set.of(), Set.of());

  private final List<List<String>> paths;
  private final Set<String> keyNames;
  private final Set<String> suffixes;

  private SensitiveFieldMarker(List<List<String>> paths, Set<String> keyNames, Set<String> suffixes) {
    this.paths = paths;
    this.keyNames = keyNames;
    this.suffixes = suffixes;
  }

  /**
   * Creates a marker from explicit paths, key names and suffixes.
   *
   * @param paths dotted key paths, {@code *} allowed as a segment
   * @param keyNames exact leaf key names
   * @param suffixes leaf key suffixes
   * @return marker
   */
  public static SensitiveFieldMarker of(
      Collection<String> paths, Collection<String> keyNames, Collection<String> suffixes) {
    List<List<String>> parsed = new ArrayList<>();
    for (String path : paths) {
      if (path == null || path.isBlank()) {
        continue;
      }
      parsed.add(List.of(path.trim().split("\\.")));
    }
    return new SensitiveFieldMarker(
        List.copyOf(parsed), clean(keyNames), clean(suffixes));
  }

  /**
   * Marker following only the {@code _secret} suffix convention.
   *
   * @return default marker
   */
  public static SensitiveFieldMarker defaults() {
    return of(List.of(), List.of(), List.of(DEFAULT_SUFFIX));
  }

  /**
   * Marker that matches nothing.
   *
   * @return empty marker
   */
  public static SensitiveFieldMarker none() {
    return NONE;
  }

  /**
   * Tests whether {@code path} is sensitive.
   *
   * @param path field path
   * @return {@code true} when the field must be stored encrypted
   */
  public boolean matches(FieldPath path) {
    List<String> keys = path.keys();
    if (keys.isEmpty()) {
      return false;
    }
    String leaf = keys.get(keys.size() - 1);
    if (keyNames.contains(leaf)) {
      return true;
    }
    for (String suffix : suffixes) {
      if (leaf.endsWith(suffix)) {
        return true;
      }
    }
    for (List<String> pattern : paths) {
      if (matchesPattern(pattern, keys)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Indicates whether the marker can match anything at all.
   *
   * @return {@code true} when no rule is configured
   */
  public boolean isEmpty() {
    return paths.isEmpty() && keyNames.isEmpty() && suffixes.isEmpty();
  }

  private static boolean matchesPattern(List<String> pattern, List<String> keys) {
    if (pattern.size() != keys.size()) {
      return false;
    }
    for (int i = 0; i < pattern.size(); i++) {
      String expected = pattern.get(i);
      if (!"*".equals(expected) && !expected.equals(keys.get(i))) {
        return false;
      }
    }
    return true;
  }

  private static Set<String> clean(Collection<String> raw) {
    Set<String> cleaned = new LinkedHashSet<>();
    for (String value : raw) {
      if (value != null && !value.isBlank()) {
        cleaned.add(value.trim());
      }
    }
    return Set.copyOf(cleaned);
  }

  @Override
  public String toString() {
    return "SensitiveFieldMarker{paths=" + paths.size() + ", keyNames=" + keyNames + ", suffixes=" + suffixes + "}";
  }
}
