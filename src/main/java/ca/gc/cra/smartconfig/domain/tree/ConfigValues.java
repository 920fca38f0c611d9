package ca.gc.cra.smartconfig.domain.tree;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between plain Java object graphs (maps, lists, boxed scalars) and {@link ConfigValue} trees.
 *
 * <p>Used by format adapters whose parsers produce generic object graphs and by tests that want compact tree
 * literals.</p>
 *
 * @since 0.1.0
 */
public final class ConfigValues {

  private ConfigValues() {}

  /**
   * Converts a Java object graph into a configuration value.
   *
   * @param raw {@code null}, {@link Boolean}, {@link Number}, {@link CharSequence}, {@link Map} with string keys,
   *     or {@link Iterable}
   * @return converted value
   * @throws IllegalArgumentException for unsupported types, non-string keys or non-finite numbers
   */
  public static ConfigValue fromJava(Object raw) {
    return fromJava(raw, FieldPath.ROOT);
  }

  private static ConfigValue fromJava(Object raw, FieldPath path) {
    if (raw == null) {
      return NullValue.INSTANCE;
    }
    if (raw instanceof ConfigValue value) {
      return value;
    }
    if (raw instanceof Boolean bool) {
      return BooleanValue.of(bool);
    }
    if (raw instanceof BigDecimal decimal) {
      return new NumberValue(decimal);
    }
    if (raw instanceof BigInteger integer) {
      return NumberValue.of(integer);
    }
    if (raw instanceof Double || raw instanceof Float) {
      double d = ((Number) raw).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("non-finite number at " + path);
      }
      return NumberValue.of(d);
    }
    if (raw instanceof Number number) {
      return NumberValue.of(number.longValue());
    }
    if (raw instanceof CharSequence text) {
      return StringValue.of(text.toString());
    }
    if (raw instanceof Map<?, ?> map) {
      MappingValue.Builder builder = MappingValue.builder();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          throw new IllegalArgumentException("non-string key at " + path + ": " + entry.getKey());
        }
        builder.put(key, fromJava(entry.getValue(), path.child(key)));
      }
      return builder.build();
    }
    if (raw instanceof Iterable<?> iterable) {
      List<ConfigValue> items = new ArrayList<>();
      int index = 0;
      for (Object item : iterable) {
        items.add(fromJava(item, path.index(index++)));
      }
      return new SequenceValue(items);
    }
    throw new IllegalArgumentException(
        "unsupported value type " + raw.getClass().getSimpleName() + " at " + path);
  }

  /**
   * Converts a configuration value into a plain Java object graph.
   *
   * @param value value to convert
   * @return {@code null}, {@link Boolean}, {@link BigDecimal}, {@link String}, {@link List} or {@link Map}
   */
  public static Object toJava(ConfigValue value) {
    if (value instanceof NullValue) {
      return null;
    }
    if (value instanceof BooleanValue bool) {
      return bool.value();
    }
    if (value instanceof NumberValue number) {
      return number.value();
    }
    if (value instanceof StringValue text) {
      return text.value();
    }
    if (value instanceof SequenceValue sequence) {
      List<Object> items = new ArrayList<>(sequence.size());
      for (ConfigValue item : sequence.items()) {
        items.add(toJava(item));
      }
      return items;
    }
    MappingValue mapping = (MappingValue) value;
    Map<String, Object> map = new LinkedHashMap<>();
    mapping.entries().forEach((key, child) -> map.put(key, toJava(child)));
    return map;
  }

  /**
   * Converts a Java map into a mapping value.
   *
   * @param map source map with string keys
   * @return mapping value
   */
  public static MappingValue mapping(Map<String, ?> map) {
    return (MappingValue) fromJava(map);
  }
}
