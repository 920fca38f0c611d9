package ca.gc.cra.smartconfig.application.schema;

import ca.gc.cra.smartconfig.domain.schema.FieldRule;
import ca.gc.cra.smartconfig.domain.schema.Schema;
import ca.gc.cra.smartconfig.domain.tree.BooleanValue;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.NumberValue;
import ca.gc.cra.smartconfig.domain.tree.SequenceValue;
import ca.gc.cra.smartconfig.domain.tree.StringValue;
import ca.gc.cra.smartconfig.domain.tree.ValueKind;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Builds a {@link Schema} from a schema document expressed as a configuration tree (in any format).
 *
 * <p>Layout:</p>
 * <pre>
 * strict: false
 * fields:
 *   db.host: { type: string, required: true }
 *   db.port: { type: number, required: true, min: 1, max: 65535 }
 *   log.level: { type: string, allowed: [debug, info, warn] }
 *   servers:
 *     type: sequence
 *     items: { type: mapping, fields: { name: { type: string, required: true } } }
 * </pre>
 *
 * <p>A rule may be abbreviated to its type name ({@code db.host: string}). A document without a
 * {@code fields} key is read as the field map itself.</p>
 *
 * @since 0.1.0
 */
public final class SchemaParser {
  private static final Set<String> RULE_KEYS =
      Set.of("type", "required", "allowed", "min", "max", "pattern", "default", "fields", "items");
  private static final String ANY = "any";

  /**
   * Parses a schema document.
   *
   * @param document schema tree
   * @return schema
   * @throws IllegalArgumentException when the document is not a valid schema; the message names the field
   */
  public Schema parse(MappingValue document) {
    ConfigValue fields = document.get("fields");
    boolean strict = false;
    ConfigValue strictValue = document.get("strict");
    if (strictValue != null) {
      if (!(strictValue instanceof BooleanValue bool)) {
        throw new IllegalArgumentException("schema 'strict' must be a boolean");
      }
      strict = bool.value();
    }
    MappingValue fieldMap;
    if (fields == null) {
      fieldMap = strictValue == null ? document : document.without("strict");
    } else if (fields instanceof MappingValue mapping) {
      fieldMap = mapping;
    } else {
      throw new IllegalArgumentException("schema 'fields' must be a mapping");
    }
    return Schema.of(parseFields(fieldMap, ""), strict);
  }

  private Map<String, FieldRule> parseFields(MappingValue fields, String prefix) {
    Map<String, FieldRule> rules = new LinkedHashMap<>();
    for (Map.Entry<String, ConfigValue> entry : fields.entries().entrySet()) {
      String label = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
      rules.put(entry.getKey(), parseRule(entry.getValue(), label));
    }
    return rules;
  }

  private FieldRule parseRule(ConfigValue definition, String label) {
    if (definition instanceof StringValue shorthand) {
      FieldRule.Builder builder = FieldRule.builder();
      applyType(builder, shorthand.value(), label);
      return builder.build();
    }
    if (!(definition instanceof MappingValue mapping)) {
      throw new IllegalArgumentException("schema field " + label + ": rule must be a mapping or a type name");
    }
    for (String key : mapping.keys()) {
      if (!RULE_KEYS.contains(key)) {
        throw new IllegalArgumentException("schema field " + label + ": unknown rule attribute '" + key + "'");
      }
    }
    FieldRule.Builder builder = FieldRule.builder();
    ConfigValue type = mapping.get("type");
    if (type != null) {
      applyType(builder, requireString(type, label, "type"), label);
    } else if (mapping.containsKey("fields")) {
      builder.kind(ValueKind.MAPPING);
    } else if (mapping.containsKey("items")) {
      builder.kind(ValueKind.SEQUENCE);
    }
    ConfigValue required = mapping.get("required");
    if (required != null) {
      if (!(required instanceof BooleanValue bool)) {
        throw new IllegalArgumentException("schema field " + label + ": 'required' must be a boolean");
      }
      builder.required(bool.value());
    }
    ConfigValue allowed = mapping.get("allowed");
    if (allowed != null) {
      if (!(allowed instanceof SequenceValue sequence)) {
        throw new IllegalArgumentException("schema field " + label + ": 'allowed' must be a sequence");
      }
      builder.allowed(sequence.items());
    }
    builder.min(bound(mapping.get("min"), label, "min"));
    builder.max(bound(mapping.get("max"), label, "max"));
    ConfigValue pattern = mapping.get("pattern");
    if (pattern != null) {
      String regex = requireString(pattern, label, "pattern");
      try {
        builder.pattern(Pattern.compile(regex));
      } catch (PatternSyntaxException ex) {
        throw new IllegalArgumentException("schema field " + label + ": invalid pattern", ex);
      }
    }
    ConfigValue fields = mapping.get("fields");
    if (fields != null) {
      if (!(fields instanceof MappingValue nested)) {
        throw new IllegalArgumentException("schema field " + label + ": 'fields' must be a mapping");
      }
      Schema.of(parseFields(nested, label), false).root().children().forEach(builder::child);
    }
    ConfigValue items = mapping.get("items");
    if (items != null) {
      builder.items(parseRule(items, label + "[]"));
    }
    FieldRule rule = builder.defaultValue(mapping.get("default")).build();
    if (rule.defaultValue() != null && rule.kind() != null && rule.defaultValue().kind() != rule.kind()) {
      throw new IllegalArgumentException("schema field " + label + ": default does not match type "
          + rule.kind().label());
    }
    return rule;
  }

  private static void applyType(FieldRule.Builder builder, String type, String label) {
    if (ANY.equalsIgnoreCase(type.trim())) {
      builder.kind(null);
      return;
    }
    try {
      builder.kind(ValueKind.fromLabel(type));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("schema field " + label + ": unknown type '" + type + "'", ex);
    }
  }

  private static BigDecimal bound(ConfigValue value, String label, String attribute) {
    if (value == null) {
      return null;
    }
    if (!(value instanceof NumberValue number)) {
      throw new IllegalArgumentException("schema field " + label + ": '" + attribute + "' must be a number");
    }
    return number.value();
  }

  private static String requireString(ConfigValue value, String label, String attribute) {
    if (!(value instanceof StringValue text)) {
      throw new IllegalArgumentException("schema field " + label + ": '" + attribute + "' must be a string");
    }
    return text.value();
  }
}
