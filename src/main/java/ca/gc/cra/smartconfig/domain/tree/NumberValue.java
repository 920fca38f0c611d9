package ca.gc.cra.smartconfig.domain.tree;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Arbitrary-precision numeric configuration value.
 *
 * <p>Equality is numeric: {@code 1.0} equals {@code 1}. The stored scale is kept so serializers can reproduce
 * the number as it was read.</p>
 *
 * @param value decimal value; never {@code null}
 * @since 0.1.0
 */
public record NumberValue(BigDecimal value) implements ConfigValue {

  public NumberValue {
    Objects.requireNonNull(value, "value");
  }

  /**
   * Wraps an integral value.
   *
   * @param value integral value
   * @return number value
   */
  public static NumberValue of(long value) {
    return new NumberValue(BigDecimal.valueOf(value));
  }

  /**
   * Wraps a big integer.
   *
   * @param value integral value
   * @return number value
   */
  public static NumberValue of(BigInteger value) {
    return new NumberValue(new BigDecimal(value));
  }

  /**
   * Wraps a floating point value using its shortest decimal representation.
   *
   * @param value finite double
   * @return number value
   * @throws IllegalArgumentException when {@code value} is NaN or infinite
   */
  public static NumberValue of(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new IllegalArgumentException("non-finite numbers are not supported: " + value);
    }
    return new NumberValue(BigDecimal.valueOf(value));
  }

  /**
   * Parses a decimal literal.
   *
   * @param literal text such as {@code "42"} or {@code "-1.5e3"}
   * @return number value
   * @throws NumberFormatException when the literal is not a decimal number
   */
  public static NumberValue parse(String literal) {
    return new NumberValue(new BigDecimal(literal.trim()));
  }

  /**
   * Indicates whether the value has no fractional part.
   *
   * @return {@code true} for integral values
   */
  public boolean isIntegral() {
    return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
  }

  /**
   * Canonical text used for hashing: trailing zeros stripped, never in exponent notation.
   *
   * @return canonical decimal text
   */
  public String canonicalText() {
    if (value.signum() == 0) {
      return "0";
    }
    return value.stripTrailingZeros().toPlainString();
  }

  @Override
  public ValueKind kind() {
    return ValueKind.NUMBER;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof NumberValue that && value.compareTo(that.value) == 0;
  }

  @Override
  public int hashCode() {
    return canonicalText().hashCode();
  }

  @Override
  public String toString() {
    return value.toPlainString();
  }
}
