package ca.gc.cra.smartconfig.application.schema;

import ca.gc.cra.smartconfig.domain.schema.FieldError;
import ca.gc.cra.smartconfig.domain.schema.FieldErrorKind;
import ca.gc.cra.smartconfig.domain.schema.FieldRule;
import ca.gc.cra.smartconfig.domain.schema.Schema;
import ca.gc.cra.smartconfig.domain.schema.ValidationResult;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.NumberValue;
import ca.gc.cra.smartconfig.domain.tree.SequenceValue;
import ca.gc.cra.smartconfig.domain.tree.StringValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks a configuration tree against a {@link Schema}.
 *
 * <p>Validation is pure and exhaustive: the tree is never modified and every violation is reported, not just
 * the first. Fields the schema does not mention are accepted unless the schema is strict. Error messages
 * describe the constraint and never repeat the offending value.</p>
 *
 * @since 0.1.0
 */
public final class SchemaValidator {

  /**
   * Validates {@code tree} against {@code schema}.
   *
   * @param tree tree to check
   * @param schema expected shape
   * @return every violation found, in tree order
   */
  public ValidationResult validate(ConfigValue tree, Schema schema) {
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(schema, "schema");
    List<FieldError> errors = new ArrayList<>();
    checkField(FieldPath.ROOT, schema.root(), tree, schema.strict(), errors);
    return new ValidationResult(errors);
  }

  private void checkField(
      FieldPath path, FieldRule rule, ConfigValue value, boolean strict, List<FieldError> errors) {
    if (rule.kind() != null && value.kind() != rule.kind()) {
      errors.add(new FieldError(path, FieldErrorKind.TYPE_MISMATCH,
          "expected " + rule.kind().label() + " but was " + value.kind().label()));
      return;
    }
    checkConstraints(path, rule, value, errors);

    if (value instanceof MappingValue mapping) {
      for (Map.Entry<String, FieldRule> child : rule.children().entrySet()) {
        FieldPath childPath = path.child(child.getKey());
        ConfigValue childValue = mapping.get(child.getKey());
        if (childValue == null) {
          reportMissing(childPath, child.getValue(), errors);
          continue;
        }
        checkField(childPath, child.getValue(), childValue, strict, errors);
      }
      if (strict && (rule.declaresChildren() || path.isRoot())) {
        for (String key : mapping.keys()) {
          if (!rule.children().containsKey(key)) {
            errors.add(new FieldError(
                path.child(key), FieldErrorKind.UNKNOWN_FIELD, "field is not declared by the schema"));
          }
        }
      }
    } else if (value instanceof SequenceValue sequence && rule.items() != null) {
      for (int i = 0; i < sequence.size(); i++) {
        checkField(path.index(i), rule.items(), sequence.get(i), strict, errors);
      }
    }
  }

  // An absent mapping also lacks every required field below it.
  private void reportMissing(FieldPath path, FieldRule rule, List<FieldError> errors) {
    if (rule.required()) {
      errors.add(new FieldError(path, FieldErrorKind.MISSING_FIELD, "required field is missing"));
      return;
    }
    for (Map.Entry<String, FieldRule> child : rule.children().entrySet()) {
      reportMissing(path.child(child.getKey()), child.getValue(), errors);
    }
  }

  private void checkConstraints(FieldPath path, FieldRule rule, ConfigValue value, List<FieldError> errors) {
    if (!rule.allowed().isEmpty() && !rule.allowed().contains(value)) {
      errors.add(new FieldError(path, FieldErrorKind.CONSTRAINT_VIOLATION,
          "value is not one of the allowed values " + rule.allowed()));
    }
    if (value instanceof NumberValue number) {
      if (rule.min() != null && number.value().compareTo(rule.min()) < 0) {
        errors.add(new FieldError(path, FieldErrorKind.CONSTRAINT_VIOLATION,
            "must be >= " + rule.min().toPlainString()));
      }
      if (rule.max() != null && number.value().compareTo(rule.max()) > 0) {
        errors.add(new FieldError(path, FieldErrorKind.CONSTRAINT_VIOLATION,
            "must be <= " + rule.max().toPlainString()));
      }
    }
    if (value instanceof StringValue text && rule.pattern() != null
        && !rule.pattern().matcher(text.value()).matches()) {
      errors.add(new FieldError(path, FieldErrorKind.CONSTRAINT_VIOLATION,
          "must match pattern " + rule.pattern().pattern()));
    }
  }
}
