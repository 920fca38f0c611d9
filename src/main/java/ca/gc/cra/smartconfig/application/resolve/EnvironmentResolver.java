package ca.gc.cra.smartconfig.application.resolve;

import ca.gc.cra.smartconfig.domain.error.UnresolvedReferenceException;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.SequenceValue;
import ca.gc.cra.smartconfig.domain.tree.StringValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Substitutes {@code ${NAME}} and {@code ${NAME:-default}} placeholders inside string values.
 *
 * <p>A variable that is unset or empty falls back to its default; without a default the resolver fails with
 * {@link UnresolvedReferenceException} naming the field path. <code>$${</code> yields a literal <code>${</code>.
 * Non-string values pass through untouched.</p>
 *
 * <p>Stateless; the environment is supplied per call so tests never depend on the real process
 * environment.</p>
 *
 * @since 0.1.0
 */
public final class EnvironmentResolver {
  private static final Logger log = LoggerFactory.getLogger(EnvironmentResolver.class);
  private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");
  private static final String DEFAULT_SEPARATOR = ":-";

  /**
   * Resolves placeholders against the process environment.
   *
   * @param value tree to resolve
   * @return resolved tree
   */
  public ConfigValue resolve(ConfigValue value) {
    return resolve(value, System::getenv);
  }

  /**
   * Resolves placeholders against {@code envLookup}.
   *
   * @param value tree to resolve
   * @param envLookup returns a variable's value or {@code null} when unset
   * @return resolved tree; unchanged subtrees are shared
   * @throws UnresolvedReferenceException when a placeholder has no value and no default, or is malformed
   */
  public ConfigValue resolve(ConfigValue value, Function<String, String> envLookup) {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(envLookup, "envLookup");
    return resolveAt(value, FieldPath.ROOT, envLookup);
  }

  /**
   * Resolves a mapping root, keeping the mapping type.
   *
   * @param root mapping to resolve
   * @param envLookup environment lookup
   * @return resolved mapping
   */
  public MappingValue resolveMapping(MappingValue root, Function<String, String> envLookup) {
    return (MappingValue) resolve(root, envLookup);
  }

  private ConfigValue resolveAt(ConfigValue value, FieldPath path, Function<String, String> env) {
    if (value instanceof StringValue text) {
      String resolved = substitute(text.value(), path, env);
      return resolved.equals(text.value()) ? text : StringValue.of(resolved);
    }
    if (value instanceof SequenceValue sequence) {
      List<ConfigValue> items = new ArrayList<>(sequence.size());
      for (int i = 0; i < sequence.size(); i++) {
        items.add(resolveAt(sequence.get(i), path.index(i), env));
      }
      return new SequenceValue(items);
    }
    if (value instanceof MappingValue mapping) {
      MappingValue.Builder builder = MappingValue.builder();
      for (Map.Entry<String, ConfigValue> entry : mapping.entries().entrySet()) {
        builder.put(entry.getKey(), resolveAt(entry.getValue(), path.child(entry.getKey()), env));
      }
      return builder.build();
    }
    return value;
  }

  /**
   * Expands placeholders in a single string.
   *
   * @param text input text
   * @param path field path reported on failure
   * @param env environment lookup
   * @return expanded text
   */
  String substitute(String text, FieldPath path, Function<String, String> env) {
    if (text.indexOf('$') < 0) {
      return text;
    }
    StringBuilder out = new StringBuilder(text.length());
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '$' && text.startsWith("$${", i)) {
        out.append("${");
        i += 3;
        continue;
      }
      if (c == '$' && text.startsWith("${", i)) {
        int close = text.indexOf('}', i + 2);
        if (close < 0) {
          throw new UnresolvedReferenceException(
              path.toString(), text.substring(i + 2), "Unterminated placeholder");
        }
        out.append(expand(text.substring(i + 2, close), path, env));
        i = close + 1;
        continue;
      }
      out.append(c);
      i++;
    }
    return out.toString();
  }

  private String expand(String body, FieldPath path, Function<String, String> env) {
    int separator = body.indexOf(DEFAULT_SEPARATOR);
    String name = separator < 0 ? body : body.substring(0, separator);
    String fallback = separator < 0 ? null : body.substring(separator + DEFAULT_SEPARATOR.length());
    if (!NAME_PATTERN.matcher(name).matches()) {
      throw new UnresolvedReferenceException(path.toString(), name, "Invalid variable name '" + name + "'");
    }
    String value = env.apply(name);
    if (value != null && !value.isEmpty()) {
      return value;
    }
    if (fallback != null) {
      log.debug("Variable {} unset at {}; using default", name, path);
      return fallback;
    }
    throw new UnresolvedReferenceException(path.toString(), name);
  }
}
