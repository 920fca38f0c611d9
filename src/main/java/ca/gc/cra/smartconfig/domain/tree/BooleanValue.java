package ca.gc.cra.smartconfig.domain.tree;

/**
 * Boolean configuration value.
 *
 * @param value wrapped flag
 * @since 0.1.0
 */
public record BooleanValue(boolean value) implements ConfigValue {
  public static final BooleanValue TRUE = new BooleanValue(true);
  public static final BooleanValue FALSE = new BooleanValue(false);

  /**
   * Returns the shared instance for {@code value}.
   *
   * @param value flag to wrap
   * @return {@link #TRUE} or {@link #FALSE}
   */
  public static BooleanValue of(boolean value) {
    return value ? TRUE : FALSE;
  }

  @Override
  public ValueKind kind() {
    return ValueKind.BOOLEAN;
  }

  @Override
  public String toString() {
    return Boolean.toString(value);
  }
}
