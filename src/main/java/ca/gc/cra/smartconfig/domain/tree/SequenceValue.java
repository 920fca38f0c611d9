package ca.gc.cra.smartconfig.domain.tree;

import java.util.List;

/**
 * Ordered sequence of configuration values.
 *
 * @param items immutable element list
 * @since 0.1.0
 */
public record SequenceValue(List<ConfigValue> items) implements ConfigValue {
  public static final SequenceValue EMPTY = new SequenceValue(List.of());

  public SequenceValue {
    items = List.copyOf(items);
  }

  /**
   * Creates a sequence from the supplied elements.
   *
   * @param items elements in order
   * @return sequence value
   */
  public static SequenceValue of(ConfigValue... items) {
    return new SequenceValue(List.of(items));
  }

  /**
   * Returns the number of elements.
   *
   * @return element count
   */
  public int size() {
    return items.size();
  }

  /**
   * Returns the element at {@code index}.
   *
   * @param index zero-based position
   * @return element
   */
  public ConfigValue get(int index) {
    return items.get(index);
  }

  @Override
  public ValueKind kind() {
    return ValueKind.SEQUENCE;
  }

  @Override
  public String toString() {
    return items.toString();
  }
}
