package ca.gc.cra.smartconfig.domain.schema;

import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.domain.tree.ValueKind;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Constraint on a single field of a configuration tree.
 *
 * @param kind expected kind, or {@code null} to accept any kind
 * @param required whether the field must be present
 * @param allowed permitted values; empty means unrestricted
 * @param min inclusive lower bound for numbers, may be {@code null}
 * @param max inclusive upper bound for numbers, may be {@code null}
 * @param pattern regular expression a string must fully match, may be {@code null}
 * @param defaultValue value used by template generation, may be {@code null}
 * @param children rules for the children of a mapping field, in declaration order
 * @param items rule applied to every element of a sequence field, may be {@code null}
 * @since 0.1.0
 */
public record FieldRule(
    ValueKind kind,
    boolean required,
    List<ConfigValue> allowed,
    BigDecimal min,
    BigDecimal max,
    Pattern pattern,
    ConfigValue defaultValue,
    Map<String, FieldRule> children,
    FieldRule items) {

  public FieldRule {
    allowed = List.copyOf(allowed);
    children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
  }

  /**
   * Rule for an intermediate mapping implied by a dotted path such as {@code db.port}.
   *
   * @param children child rules
   * @return optional mapping rule
   */
  public static FieldRule implicitMapping(Map<String, FieldRule> children) {
    return new FieldRule(ValueKind.MAPPING, false, List.of(), null, null, null, null, children, null);
  }

  /**
   * Starts a builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Indicates whether the schema declares the children of this field, which enables strict-mode checks on it.
   *
   * @return {@code true} when child rules exist
   */
  public boolean declaresChildren() {
    return !children.isEmpty();
  }

  /** Mutable builder for {@link FieldRule}. */
  public static final class Builder {
    private ValueKind kind;
    private boolean required;
    private List<ConfigValue> allowed = List.of();
    private BigDecimal min;
    private BigDecimal max;
    private Pattern pattern;
    private ConfigValue defaultValue;
    private final Map<String, FieldRule> children = new LinkedHashMap<>();
    private FieldRule items;

    private Builder() {}

    public Builder kind(ValueKind kind) {
      this.kind = kind;
      return this;
    }

    public Builder required(boolean required) {
      this.required = required;
      return this;
    }

    public Builder allowed(List<ConfigValue> allowed) {
      this.allowed = allowed;
      return this;
    }

    public Builder min(BigDecimal min) {
      this.min = min;
      return this;
    }

    public Builder max(BigDecimal max) {
      this.max = max;
      return this;
    }

    public Builder pattern(Pattern pattern) {
      this.pattern = pattern;
      return this;
    }

    public Builder defaultValue(ConfigValue defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    public Builder child(String key, FieldRule rule) {
      this.children.put(key, rule);
      return this;
    }

    public Builder items(FieldRule items) {
      this.items = items;
      return this;
    }

    public FieldRule build() {
      return new FieldRule(kind, required, allowed, min, max, pattern, defaultValue, children, items);
    }
  }
}
