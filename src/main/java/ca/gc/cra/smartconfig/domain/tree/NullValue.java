package ca.gc.cra.smartconfig.domain.tree;

/**
 * Explicit null configuration value.
 *
 * @since 0.1.0
 */
public record NullValue() implements ConfigValue {
  /** Shared instance; all null values are equal. */
  public static final NullValue INSTANCE = new NullValue();

  @Override
  public ValueKind kind() {
    return ValueKind.NULL;
  }

  @Override
  public String toString() {
    return "null";
  }
}
