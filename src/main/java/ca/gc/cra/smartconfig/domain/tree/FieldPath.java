package ca.gc.cra.smartconfig.domain.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Location of a value inside a configuration tree, rendered as {@code db.pool.size} or {@code servers[0].host}.
 *
 * <p>Keys containing a dot are addressable programmatically but render ambiguously; dotted schema paths and
 * sensitive-field markers cannot target them.</p>
 *
 * @since 0.1.0
 */
public final class FieldPath implements Comparable<FieldPath> {
  /** Path of the document root. */
  public static final FieldPath ROOT = new FieldPath(List.of());

  private final List<Segment> segments;

  private FieldPath(List<Segment> segments) {
    this.segments = segments;
  }

  /**
   * Parses a rendered path such as {@code db.hosts[1].name}.
   *
   * @param text rendered path; blank yields {@link #ROOT}
   * @return parsed path
   * @throws IllegalArgumentException when an index is malformed or a key segment is empty
   */
  public static FieldPath parse(String text) {
    if (text == null || text.isBlank()) {
      return ROOT;
    }
    List<Segment> parsed = new ArrayList<>();
    StringBuilder key = new StringBuilder();
    int i = 0;
    String trimmed = text.trim();
    while (i < trimmed.length()) {
      char c = trimmed.charAt(i);
      if (c == '.') {
        flushKey(trimmed, key, parsed, i);
        i++;
      } else if (c == '[') {
        if (key.length() > 0) {
          parsed.add(Segment.key(key.toString()));
          key.setLength(0);
        }
        int close = trimmed.indexOf(']', i);
        if (close < 0) {
          throw new IllegalArgumentException("unterminated index in path: " + text);
        }
        String digits = trimmed.substring(i + 1, close);
        try {
          parsed.add(Segment.index(Integer.parseInt(digits)));
        } catch (NumberFormatException ex) {
          throw new IllegalArgumentException("invalid index '" + digits + "' in path: " + text, ex);
        }
        i = close + 1;
        if (i < trimmed.length() && trimmed.charAt(i) == '.') {
          i++;
        }
      } else {
        key.append(c);
        i++;
      }
    }
    if (key.length() > 0) {
      parsed.add(Segment.key(key.toString()));
    } else if (trimmed.endsWith(".")) {
      throw new IllegalArgumentException("empty key segment in path: " + text);
    }
    return new FieldPath(List.copyOf(parsed));
  }

  private static void flushKey(String text, StringBuilder key, List<Segment> parsed, int position) {
    if (key.length() == 0) {
      if (position == 0 || text.charAt(position - 1) != ']') {
        throw new IllegalArgumentException("empty key segment in path: " + text);
      }
      return;
    }
    parsed.add(Segment.key(key.toString()));
    key.setLength(0);
  }

  /**
   * Returns a child path addressing mapping key {@code key}.
   *
   * @param key child key
   * @return extended path
   */
  public FieldPath child(String key) {
    return append(Segment.key(key));
  }

  /**
   * Returns a child path addressing sequence element {@code index}.
   *
   * @param index zero-based element index
   * @return extended path
   */
  public FieldPath index(int index) {
    return append(Segment.index(index));
  }

  private FieldPath append(Segment segment) {
    List<Segment> extended = new ArrayList<>(segments.size() + 1);
    extended.addAll(segments);
    extended.add(segment);
    return new FieldPath(Collections.unmodifiableList(extended));
  }

  /**
   * Returns the segments of this path.
   *
   * @return immutable segment list
   */
  public List<Segment> segments() {
    return segments;
  }

  /**
   * Returns only the mapping-key segments, dropping sequence indices.
   *
   * @return key names from root to leaf
   */
  public List<String> keys() {
    List<String> keys = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      if (!segment.isIndex()) {
        keys.add(segment.key());
      }
    }
    return keys;
  }

  /**
   * Returns the last mapping key of the path, if any.
   *
   * @return leaf key or {@code null} for the root or a pure index path
   */
  public String leafKey() {
    for (int i = segments.size() - 1; i >= 0; i--) {
      if (!segments.get(i).isIndex()) {
        return segments.get(i).key();
      }
    }
    return null;
  }

  /**
   * Indicates whether this is the root path.
   *
   * @return {@code true} for the root
   */
  public boolean isRoot() {
    return segments.isEmpty();
  }

  @Override
  public int compareTo(FieldPath other) {
    return toString().compareTo(other.toString());
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof FieldPath that && segments.equals(that.segments);
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  @Override
  public String toString() {
    if (segments.isEmpty()) {
      return "<root>";
    }
    StringBuilder sb = new StringBuilder();
    for (Segment segment : segments) {
      if (segment.isIndex()) {
        sb.append('[').append(segment.index()).append(']');
      } else {
        if (sb.length() > 0) {
          sb.append('.');
        }
        sb.append(segment.key());
      }
    }
    return sb.toString();
  }

  /**
   * Single path step: a mapping key or a sequence index.
   *
   * @param key mapping key, {@code null} for index segments
   * @param index element index, {@code -1} for key segments
   */
  public record Segment(String key, int index) {
    static Segment key(String key) {
      return new Segment(Objects.requireNonNull(key, "key"), -1);
    }

    static Segment index(int index) {
      if (index < 0) {
        throw new IllegalArgumentException("index must be >= 0");
      }
      return new Segment(null, index);
    }

    /**
     * Indicates whether this segment addresses a sequence element.
     *
     * @return {@code true} for index segments
     */
    public boolean isIndex() {
      return key == null;
    }
  }
}
