package ca.gc.cra.smartconfig.domain.tree;

import java.util.Objects;

/**
 * String configuration value.
 *
 * @param value text; never {@code null}
 * @since 0.1.0
 */
public record StringValue(String value) implements ConfigValue {

  public StringValue {
    Objects.requireNonNull(value, "value");
  }

  /**
   * Wraps {@code value}.
   *
   * @param value text
   * @return string value
   */
  public static StringValue of(String value) {
    return new StringValue(value);
  }

  @Override
  public ValueKind kind() {
    return ValueKind.STRING;
  }

  @Override
  public String toString() {
    return value;
  }
}
