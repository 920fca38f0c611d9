package ca.gc.cra.smartconfig.domain.schema;

import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static description of the expected shape of a configuration tree.
 *
 * <p>Built once and shared read-only across validations. Dotted paths are expanded into a rule tree whose
 * intermediate levels are optional mappings.</p>
 *
 * @param root rule for the document root
 * @param strict whether fields absent from the schema are reported
 * @since 0.1.0
 */
public record Schema(FieldRule root, boolean strict) {

  public Schema {
    Objects.requireNonNull(root, "root");
  }

  /**
   * Builds a schema from dotted-path rules such as {@code db.port -> number, required}.
   *
   * @param rules rules keyed by dotted path, in declaration order
   * @param strict strict mode flag
   * @return schema
   * @throws IllegalArgumentException when a path is blank, indexed, or declared twice
   */
  public static Schema of(Map<String, FieldRule> rules, boolean strict) {
    Node top = new Node(null);
    for (Map.Entry<String, FieldRule> entry : rules.entrySet()) {
      FieldPath path = FieldPath.parse(entry.getKey());
      if (path.isRoot()) {
        throw new IllegalArgumentException("schema path must not be blank");
      }
      if (path.keys().size() != path.segments().size()) {
        throw new IllegalArgumentException("schema path must not contain indices: " + entry.getKey());
      }
      Node node = top;
      for (String key : path.keys()) {
        node = node.children.computeIfAbsent(key, k -> new Node(null));
      }
      if (node.rule != null) {
        throw new IllegalArgumentException("schema path declared twice: " + entry.getKey());
      }
      node.rule = entry.getValue();
    }
    return new Schema(top.toRule(), strict);
  }

  /**
   * Empty schema: accepts every tree.
   *
   * @return permissive schema
   */
  public static Schema permissive() {
    return new Schema(FieldRule.implicitMapping(Map.of()), false);
  }

  /**
   * Returns a copy with a different strict flag.
   *
   * @param strictMode strict flag
   * @return schema sharing the rule tree
   */
  public Schema withStrict(boolean strictMode) {
    return strictMode == strict ? this : new Schema(root, strictMode);
  }

  private static final class Node {
    private FieldRule rule;
    private final Map<String, Node> children = new LinkedHashMap<>();

    private Node(FieldRule rule) {
      this.rule = rule;
    }

    private FieldRule toRule() {
      Map<String, FieldRule> childRules = new LinkedHashMap<>();
      children.forEach((key, child) -> childRules.put(key, child.toRule()));
      if (rule == null) {
        return FieldRule.implicitMapping(childRules);
      }
      if (childRules.isEmpty()) {
        return rule;
      }
      Map<String, FieldRule> merged = new LinkedHashMap<>(rule.children());
      merged.putAll(childRules);
      return new FieldRule(
          rule.kind(),
          rule.required(),
          rule.allowed(),
          rule.min(),
          rule.max(),
          rule.pattern(),
          rule.defaultValue(),
          merged,
          rule.items());
    }
  }

  /**
   * Lists the top-level field names declared by the schema.
   *
   * @return declared root keys in order
   */
  public List<String> rootFields() {
    return List.copyOf(root.children().keySet());
  }
}
