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
import ca.gc.cra.smartconfig.domain.tree.NullValue;
import ca.gc.cra.smartconfig.domain.tree.NumberValue;
import ca.gc.cra.smartconfig.domain.tree.SequenceValue;
import ca.gc.cra.smartconfig.domain.tree.StringValue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * INI adapter.
 *
 * <p>Grammar: {@code [section]} headers, where a dotted name such as {@code [db.pool]} denotes a nested
 * mapping; {@code key = value} or {@code key: value} entries; full-line comments starting with {@code ;} or
 * {@code #}. Entries before the first header belong to the root. Unquoted values are read as booleans
 * ({@code true}/{@code false}), numbers or raw text; double-quoted values are always strings; an empty value
 * is null.</p>
 *
 * <p>On output strings are always double-quoted, null is written as {@code key =}, root scalars precede the
 * first section and nested mappings become dotted sections. Sequences cannot be expressed and fail with the
 * offending path.</p>
 *
 * @since 0.1.0
 */
public final class IniFormatAdapter implements FormatAdapter {
  private static final Pattern NUMBER = Pattern.compile("-?(0|[1-9][0-9]*)(\\.[0-9]+)?([eE][+-]?[0-9]+)?");

  @Override
  public ConfigFormat format() {
    return ConfigFormat.INI;
  }

  @Override
  public ConfigDocument parse(String text, String origin) {
    Objects.requireNonNull(text, "text");
    Section root = new Section();
    Section current = root;
    Set<String> declaredSections = new HashSet<>();
    String[] lines = text.split("\r?\n", -1);
    for (int i = 0; i < lines.length; i++) {
      int lineNo = i + 1;
      String raw = lines[i];
      String line = raw.strip();
      if (line.isEmpty() || line.startsWith(";") || line.startsWith("#")) {
        continue;
      }
      int indent = raw.indexOf(line.charAt(0)) + 1;
      if (line.startsWith("[")) {
        if (!line.endsWith("]")) {
          throw new ConfigSyntaxException(origin, lineNo, indent, "unterminated section header", null);
        }
        String name = line.substring(1, line.length() - 1).strip();
        if (!declaredSections.add(name)) {
          throw new ConfigSyntaxException(origin, lineNo, indent, "duplicate section [" + name + "]", null);
        }
        current = root;
        for (String segment : name.split("\\.", -1)) {
          String key = segment.strip();
          if (key.isEmpty()) {
            throw new ConfigSyntaxException(origin, lineNo, indent, "empty section name segment", null);
          }
          current = current.section(key);
          if (current == null) {
            throw new ConfigSyntaxException(origin, lineNo, indent,
                "section [" + name + "] conflicts with a key of the same name", null);
          }
        }
        continue;
      }
      int separator = separatorIndex(line);
      if (separator < 0) {
        throw new ConfigSyntaxException(origin, lineNo, indent, "expected 'key = value'", null);
      }
      String key = line.substring(0, separator).strip();
      if (key.isEmpty()) {
        throw new ConfigSyntaxException(origin, lineNo, indent, "empty key", null);
      }
      String rawValue = line.substring(separator + 1).strip();
      int valueColumn = indent + separator + 1;
      ConfigValue value = parseValue(rawValue, origin, lineNo, valueColumn);
      if (current.children.containsKey(key)) {
        throw new ConfigSyntaxException(origin, lineNo, indent, "duplicate key '" + key + "'", null);
      }
      current.children.put(key, value);
    }
    return new ConfigDocument(root.toMapping(), ConfigFormat.INI, origin);
  }

  @Override
  public String serialize(ConfigValue value) {
    Objects.requireNonNull(value, "value");
    if (!(value instanceof MappingValue root)) {
      throw new SerializationException(ConfigFormat.INI, "<root>", "INI documents must be mappings");
    }
    StringBuilder out = new StringBuilder();
    writeSection(List.of(), root, FieldPath.ROOT, out);
    return out.toString();
  }

  private static int separatorIndex(String line) {
    int equals = line.indexOf('=');
    int colon = line.indexOf(':');
    if (equals < 0) {
      return colon;
    }
    return colon < 0 ? equals : Math.min(equals, colon);
  }

  private static ConfigValue parseValue(String text, String origin, int line, int column) {
    if (text.isEmpty()) {
      return NullValue.INSTANCE;
    }
    if (text.startsWith("\"")) {
      return StringValue.of(unquote(text, origin, line, column));
    }
    String lower = text.toLowerCase(Locale.ROOT);
    if (lower.equals("true") || lower.equals("false")) {
      return BooleanValue.of(lower.equals("true"));
    }
    if (NUMBER.matcher(text).matches()) {
      return NumberValue.parse(text);
    }
    return StringValue.of(text);
  }

  private static String unquote(String text, String origin, int line, int column) {
    StringBuilder out = new StringBuilder(text.length());
    int i = 1;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '"') {
        if (i != text.length() - 1) {
          throw new ConfigSyntaxException(origin, line, column + i, "unexpected text after closing quote", null);
        }
        return out.toString();
      }
      if (c == '\\') {
        if (i + 1 >= text.length()) {
          break;
        }
        char escaped = text.charAt(++i);
        switch (escaped) {
          case 'n' -> out.append('\n');
          case 'r' -> out.append('\r');
          case 't' -> out.append('\t');
          case '"' -> out.append('"');
          case '\\' -> out.append('\\');
          default -> throw new ConfigSyntaxException(
              origin, line, column + i, "unknown escape sequence \\" + escaped, null);
        }
      } else {
        out.append(c);
      }
      i++;
    }
    throw new ConfigSyntaxException(origin, line, column, "unterminated quoted value", null);
  }

  private void writeSection(List<String> sectionPath, MappingValue section, FieldPath path, StringBuilder out) {
    boolean hasScalars = section.entries().values().stream().anyMatch(v -> !v.isMapping());
    if (!sectionPath.isEmpty() && (hasScalars || section.size() == 0)) {
      if (out.length() > 0) {
        out.append('\n');
      }
      out.append('[').append(String.join(".", sectionPath)).append("]\n");
    }
    for (Map.Entry<String, ConfigValue> entry : section.entries().entrySet()) {
      FieldPath child = path.child(entry.getKey());
      ConfigValue value = entry.getValue();
      if (value.isMapping()) {
        continue;
      }
      checkKey(entry.getKey(), child);
      out.append(entry.getKey()).append(" =");
      String literal = literal(value, child);
      if (!literal.isEmpty()) {
        out.append(' ').append(literal);
      }
      out.append('\n');
    }
    for (Map.Entry<String, ConfigValue> entry : section.entries().entrySet()) {
      if (entry.getValue() instanceof MappingValue mapping) {
        FieldPath child = path.child(entry.getKey());
        checkSectionName(entry.getKey(), child);
        List<String> nested = new ArrayList<>(sectionPath);
        nested.add(entry.getKey());
        writeSection(nested, mapping, child, out);
      }
    }
  }

  private static String literal(ConfigValue value, FieldPath path) {
    if (value instanceof StringValue text) {
      return quote(text.value());
    }
    if (value instanceof NumberValue number) {
      return number.canonicalText();
    }
    if (value instanceof BooleanValue bool) {
      return bool.value() ? "true" : "false";
    }
    if (value instanceof SequenceValue) {
      throw new SerializationException(ConfigFormat.INI, path.toString(), "sequences cannot be expressed in INI");
    }
    return "";
  }

  private static void checkKey(String key, FieldPath path) {
    if (key.isEmpty() || !key.equals(key.strip()) || key.startsWith(";") || key.startsWith("#")
        || key.startsWith("[") || key.indexOf('=') >= 0 || key.indexOf(':') >= 0 || key.indexOf('\n') >= 0) {
      throw new SerializationException(ConfigFormat.INI, path.toString(), "key cannot be expressed in INI");
    }
  }

  private static void checkSectionName(String name, FieldPath path) {
    if (name.isEmpty() || !name.equals(name.strip()) || name.indexOf('.') >= 0 || name.indexOf(']') >= 0
        || name.indexOf('\n') >= 0) {
      throw new SerializationException(ConfigFormat.INI, path.toString(), "section name cannot be expressed in INI");
    }
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
        default -> out.append(c);
      }
    }
    return out.append('"').toString();
  }

  /** Mutable section under construction; values are scalars or nested sections. */
  private static final class Section {
    private final Map<String, Object> children = new LinkedHashMap<>();

    /** Returns the named sub-section, creating it, or {@code null} when a scalar key has that name. */
    private Section section(String name) {
      Object existing = children.computeIfAbsent(name, k -> new Section());
      return existing instanceof Section section ? section : null;
    }

    private MappingValue toMapping() {
      MappingValue.Builder builder = MappingValue.builder();
      children.forEach((key, value) ->
          builder.put(key, value instanceof Section section ? section.toMapping() : (ConfigValue) value));
      return builder.build();
    }
  }
}
