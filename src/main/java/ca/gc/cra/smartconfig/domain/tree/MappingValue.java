package ca.gc.cra.smartconfig.domain.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Insertion-ordered mapping of unique string keys to configuration values.
 *
 * <p>Equality follows {@link Map#equals(Object)} and therefore ignores key order; iteration and serialization
 * follow insertion order.</p>
 *
 * @param entries immutable, insertion-ordered entries
 * @since 0.1.0
 */
public record MappingValue(Map<String, ConfigValue> entries) implements ConfigValue {
  public static final MappingValue EMPTY = new MappingValue(Map.of());

  public MappingValue {
    Objects.requireNonNull(entries, "entries");
    Map<String, ConfigValue> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ConfigValue> entry : entries.entrySet()) {
      copy.put(
          Objects.requireNonNull(entry.getKey(), "mapping key"),
          Objects.requireNonNull(entry.getValue(), "mapping value"));
    }
    entries = Collections.unmodifiableMap(copy);
  }

  /**
   * Starts a builder that preserves insertion order.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Looks up a direct child.
   *
   * @param key child key
   * @return child value, or {@code null} when absent
   */
  public ConfigValue get(String key) {
    return entries.get(key);
  }

  /**
   * Checks for a direct child.
   *
   * @param key child key
   * @return {@code true} when present
   */
  public boolean containsKey(String key) {
    return entries.containsKey(key);
  }

  /**
   * Returns the keys in insertion order.
   *
   * @return key set view
   */
  public Set<String> keys() {
    return entries.keySet();
  }

  /**
   * Returns the number of direct children.
   *
   * @return entry count
   */
  public int size() {
    return entries.size();
  }

  /**
   * Resolves a nested value.
   *
   * @param path path relative to this mapping
   * @return value at {@code path} when every segment exists
   */
  public Optional<ConfigValue> lookup(FieldPath path) {
    ConfigValue current = this;
    for (FieldPath.Segment segment : path.segments()) {
      if (segment.isIndex()) {
        if (!(current instanceof SequenceValue sequence) || segment.index() >= sequence.size()) {
          return Optional.empty();
        }
        current = sequence.get(segment.index());
      } else {
        if (!(current instanceof MappingValue mapping) || !mapping.containsKey(segment.key())) {
          return Optional.empty();
        }
        current = mapping.get(segment.key());
      }
    }
    return Optional.of(current);
  }

  /**
   * Returns a copy with {@code key} set to {@code value}; existing keys keep their position.
   *
   * @param key key to set
   * @param value new value
   * @return updated mapping
   */
  public MappingValue with(String key, ConfigValue value) {
    Map<String, ConfigValue> copy = new LinkedHashMap<>(entries);
    copy.put(key, value);
    return new MappingValue(copy);
  }

  /**
   * Returns a copy without {@code key}.
   *
   * @param key key to remove
   * @return updated mapping
   */
  public MappingValue without(String key) {
    if (!entries.containsKey(key)) {
      return this;
    }
    Map<String, ConfigValue> copy = new LinkedHashMap<>(entries);
    copy.remove(key);
    return new MappingValue(copy);
  }

  @Override
  public ValueKind kind() {
    return ValueKind.MAPPING;
  }

  @Override
  public String toString() {
    return entries.toString();
  }

  /**
   * Mutable builder for {@link MappingValue}. Not thread-safe.
   */
  public static final class Builder {
    private final Map<String, ConfigValue> entries = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String key, ConfigValue value) {
      entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder put(String key, String value) {
      return put(key, StringValue.of(value));
    }

    public Builder put(String key, long value) {
      return put(key, NumberValue.of(value));
    }

    public Builder put(String key, boolean value) {
      return put(key, BooleanValue.of(value));
    }

    public boolean containsKey(String key) {
      return entries.containsKey(key);
    }

    public MappingValue build() {
      return new MappingValue(entries);
    }
  }
}
