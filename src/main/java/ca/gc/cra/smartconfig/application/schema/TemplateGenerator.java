package ca.gc.cra.smartconfig.application.schema;

import ca.gc.cra.smartconfig.domain.schema.FieldRule;
import ca.gc.cra.smartconfig.domain.schema.Schema;
import ca.gc.cra.smartconfig.domain.tree.BooleanValue;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.NullValue;
import ca.gc.cra.smartconfig.domain.tree.NumberValue;
import ca.gc.cra.smartconfig.domain.tree.SequenceValue;
import ca.gc.cra.smartconfig.domain.tree.StringValue;
import ca.gc.cra.smartconfig.domain.tree.ValueKind;
import java.util.Map;

/**
 * Produces a skeleton configuration document from a schema.
 *
 * <p>Each declared field gets its {@code default}, else the first allowed value, else a placeholder for its
 * kind ({@code ""}, {@code 0}, {@code false}, {@code []}, {@code null}). Mapping fields recurse.</p>
 *
 * @since 0.1.0
 */
public final class TemplateGenerator {

  /**
   * Generates a template.
   *
   * @param schema schema to describe
   * @param requiredOnly when {@code true}, optional fields without a default are left out
   * @return skeleton tree
   */
  public MappingValue generate(Schema schema, boolean requiredOnly) {
    return mappingFor(schema.root(), requiredOnly);
  }

  private MappingValue mappingFor(FieldRule rule, boolean requiredOnly) {
    MappingValue.Builder builder = MappingValue.builder();
    for (Map.Entry<String, FieldRule> child : rule.children().entrySet()) {
      FieldRule childRule = child.getValue();
      if (requiredOnly && !childRule.required() && childRule.defaultValue() == null
          && !containsRequired(childRule)) {
        continue;
      }
      builder.put(child.getKey(), valueFor(childRule, requiredOnly));
    }
    return builder.build();
  }

  private ConfigValue valueFor(FieldRule rule, boolean requiredOnly) {
    if (rule.defaultValue() != null) {
      return rule.defaultValue();
    }
    if (!rule.allowed().isEmpty()) {
      return rule.allowed().get(0);
    }
    if (rule.declaresChildren() || rule.kind() == ValueKind.MAPPING) {
      return mappingFor(rule, requiredOnly);
    }
    if (rule.kind() == null) {
      return NullValue.INSTANCE;
    }
    return switch (rule.kind()) {
      case STRING -> StringValue.of("");
      case NUMBER -> NumberValue.of(rule.min() != null ? rule.min().longValue() : 0L);
      case BOOLEAN -> BooleanValue.FALSE;
      case SEQUENCE -> SequenceValue.EMPTY;
      default -> NullValue.INSTANCE;
    };
  }

  private static boolean containsRequired(FieldRule rule) {
    for (FieldRule child : rule.children().values()) {
      if (child.required() || containsRequired(child)) {
        return true;
      }
    }
    return false;
  }
}
