package ca.gc.cra.smartconfig.infrastructure.format;

import ca.gc.cra.smartconfig.application.port.FormatAdapter;
import ca.gc.cra.smartconfig.domain.error.ConfigSyntaxException;
import ca.gc.cra.smartconfig.domain.error.SerializationException;
import ca.gc.cra.smartconfig.domain.tree.BooleanValue;
import ca.gc.cra.smartconfig.domain.tree.ConfigDocument;
import ca.gc.cra.smartconfig.domain.tree.ConfigFormat;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.NumberValue;
import ca.gc.cra.smartconfig.domain.tree.SequenceValue;
import ca.gc.cra.smartconfig.domain.tree.StringValue;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlPosition;
import org.tomlj.TomlTable;

/**
 * TOML adapter: parsing through tomlj, writing through a deterministic emitter.
 *
 * <p>Narrowing: TOML has no null, so null is written as {@code ""}; date and time literals load as their ISO-8601
 * strings; floats are read as 64-bit binary floating point; integers must fit in 64 bits. Keys are read in
 * document order. On output, plain key/value pairs of a table precede its sub-tables, as TOML requires.</p>
 *
 * @since 0.1.0
 */
public final class TomlFormatAdapter implements FormatAdapter {
  private static final Pattern BARE_KEY = Pattern.compile("[A-Za-z0-9_-]+");
  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  @Override
  public ConfigFormat format() {
    return ConfigFormat.TOML;
  }

  @Override
  public ConfigDocument parse(String text, String origin) {
    Objects.requireNonNull(text, "text");
    TomlParseResult result = Toml.parse(text);
    if (result.hasErrors()) {
      TomlParseError error = result.errors().get(0);
      TomlPosition position = error.position();
      throw new ConfigSyntaxException(origin,
          position == null ? -1 : position.line(),
          position == null ? -1 : position.column(),
          error.getMessage(), error);
    }
    return new ConfigDocument(readTable(result, FieldPath.ROOT, origin), ConfigFormat.TOML, origin);
  }

  @Override
  public String serialize(ConfigValue value) {
    Objects.requireNonNull(value, "value");
    if (!(value instanceof MappingValue root)) {
      throw new SerializationException(ConfigFormat.TOML, "<root>", "TOML documents must be tables");
    }
    StringBuilder out = new StringBuilder();
    writeTable(List.of(), root, false, FieldPath.ROOT, out);
    return out.toString();
  }

  private MappingValue readTable(TomlTable table, FieldPath path, String origin) {
    List<String> keys = new ArrayList<>(table.keySet());
    keys.sort(Comparator.comparing((String key) -> table.inputPositionOf(List.of(key)),
        Comparator.nullsLast(Comparator.comparingInt(TomlPosition::line).thenComparingInt(TomlPosition::column))));
    Map<String, ConfigValue> entries = new LinkedHashMap<>();
    for (String key : keys) {
      entries.put(key, readValue(table.get(List.of(key)), path.child(key), origin));
    }
    return new MappingValue(entries);
  }

  private ConfigValue readValue(Object raw, FieldPath path, String origin) {
    if (raw instanceof TomlTable table) {
      return readTable(table, path, origin);
    }
    if (raw instanceof TomlArray array) {
      List<ConfigValue> items = new ArrayList<>(array.size());
      for (int i = 0; i < array.size(); i++) {
        items.add(readValue(array.get(i), path.index(i), origin));
      }
      return new SequenceValue(items);
    }
    if (raw instanceof String text) {
      return StringValue.of(text);
    }
    if (raw instanceof Boolean bool) {
      return BooleanValue.of(bool);
    }
    if (raw instanceof Long number) {
      return NumberValue.of(number);
    }
    if (raw instanceof Double number) {
      if (number.isNaN() || number.isInfinite()) {
        throw new ConfigSyntaxException(origin, path.toString(), "non-finite numbers are not supported");
      }
      return NumberValue.of(number);
    }
    if (raw instanceof OffsetDateTime dateTime) {
      return StringValue.of(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(dateTime));
    }
    if (raw instanceof LocalDateTime dateTime) {
      return StringValue.of(DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(dateTime));
    }
    if (raw instanceof LocalDate date) {
      return StringValue.of(DateTimeFormatter.ISO_LOCAL_DATE.format(date));
    }
    if (raw instanceof LocalTime time) {
      return StringValue.of(DateTimeFormatter.ISO_LOCAL_TIME.format(time));
    }
    throw new ConfigSyntaxException(origin, path.toString(),
        "unsupported TOML value type " + (raw == null ? "null" : raw.getClass().getSimpleName()));
  }

  private void writeTable(
      List<String> tablePath, MappingValue table, boolean arrayElement, FieldPath path, StringBuilder out) {
    boolean hasInline = table.entries().values().stream().anyMatch(v -> isInline(v));
    if (!tablePath.isEmpty() && (arrayElement || hasInline || table.size() == 0)) {
      if (out.length() > 0) {
        out.append('\n');
      }
      String header = dottedKey(tablePath);
      out.append(arrayElement ? "[[" + header + "]]" : "[" + header + "]").append('\n');
    }
    for (Map.Entry<String, ConfigValue> entry : table.entries().entrySet()) {
      if (isInline(entry.getValue())) {
        FieldPath child = path.child(entry.getKey());
        out.append(key(entry.getKey())).append(" = ").append(literal(entry.getValue(), child)).append('\n');
      }
    }
    for (Map.Entry<String, ConfigValue> entry : table.entries().entrySet()) {
      List<String> childTablePath = new ArrayList<>(tablePath);
      childTablePath.add(entry.getKey());
      FieldPath child = path.child(entry.getKey());
      if (entry.getValue() instanceof MappingValue mapping) {
        writeTable(childTablePath, mapping, false, child, out);
      } else if (isArrayOfTables(entry.getValue())) {
        SequenceValue sequence = (SequenceValue) entry.getValue();
        for (int i = 0; i < sequence.size(); i++) {
          writeTable(childTablePath, (MappingValue) sequence.get(i), true, child.index(i), out);
        }
      }
    }
  }

  private static boolean isInline(ConfigValue value) {
    return !(value instanceof MappingValue) && !isArrayOfTables(value);
  }

  private static boolean isArrayOfTables(ConfigValue value) {
    if (!(value instanceof SequenceValue sequence) || sequence.size() == 0) {
      return false;
    }
    return sequence.items().stream().allMatch(ConfigValue::isMapping);
  }

  private String literal(ConfigValue value, FieldPath path) {
    if (value instanceof StringValue text) {
      return quote(text.value());
    }
    if (value instanceof BooleanValue bool) {
      return bool.value() ? "true" : "false";
    }
    if (value instanceof NumberValue number) {
      return number(number, path);
    }
    if (value instanceof SequenceValue sequence) {
      List<String> items = new ArrayList<>(sequence.size());
      for (int i = 0; i < sequence.size(); i++) {
        items.add(literal(sequence.get(i), path.index(i)));
      }
      return items.isEmpty() ? "[]" : "[ " + String.join(", ", items) + " ]";
    }
    if (value instanceof MappingValue mapping) {
      List<String> items = new ArrayList<>(mapping.size());
      mapping.entries().forEach((k, v) -> items.add(key(k) + " = " + literal(v, path.child(k))));
      return items.isEmpty() ? "{}" : "{ " + String.join(", ", items) + " }";
    }
    return "\"\"";
  }

  private static String number(NumberValue number, FieldPath path) {
    if (number.isIntegral()) {
      BigInteger integer = number.value().toBigIntegerExact();
      if (integer.compareTo(LONG_MIN) >= 0 && integer.compareTo(LONG_MAX) <= 0) {
        return integer.toString();
      }
      // Beyond 64 bits TOML only has floats.
      double wide = number.value().doubleValue();
      if (Double.isInfinite(wide)) {
        throw new SerializationException(ConfigFormat.TOML, path.toString(), "number is out of range for TOML");
      }
      return Double.toString(wide);
    }
    BigDecimal decimal = number.value();
    return decimal.stripTrailingZeros().toPlainString();
  }

  private static String dottedKey(List<String> keys) {
    List<String> parts = new ArrayList<>(keys.size());
    keys.forEach(k -> parts.add(key(k)));
    return String.join(".", parts);
  }

  private static String key(String key) {
    return BARE_KEY.matcher(key).matches() ? key : quote(key);
  }

  private static String quote(String text) {
    StringBuilder out = new StringBuilder(text.length() + 2).append('"');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '\\' -> out.append("\\\\");
        case '"' -> out.append("\\\"");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        case '\b' -> out.append("\\b");
        case '\f' -> out.append("\\f");
        default -> {
          if (c < 0x20 || c == 0x7f) {
            out.append(String.format("\\u%04X", (int) c));
          } else {
            out.append(c);
          }
        }
      }
    }
    return out.append('"').toString();
  }
}
