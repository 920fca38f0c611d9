package ca.gc.cra.smartconfig.domain.tree;

/**
 * <strong>What:</strong> Canonical, format-independent configuration value.
 * <p><strong>Why:</strong> Every adapter, the merge engine, the validator, the vault and the history store speak
 * this one tagged union so format quirks never leak past the adapters.</p>
 * <p><strong>Role:</strong> Domain value object.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable and safe to share.</p>
 *
 * @since 0.1.0
 * @see ConfigValues
 */
public sealed interface ConfigValue
    permits NullValue, BooleanValue, NumberValue, StringValue, SequenceValue, MappingValue {

  /**
   * Returns the variant discriminator.
   *
   * @return kind of this value
   */
  ValueKind kind();

  /**
   * Convenience check for {@link ValueKind#MAPPING}.
   *
   * @return {@code true} when this value is a mapping
   */
  default boolean isMapping() {
    return kind() == ValueKind.MAPPING;
  }

  /**
   * Convenience check for {@link ValueKind#STRING}.
   *
   * @return {@code true} when this value is a string
   */
  default boolean isString() {
    return kind() == ValueKind.STRING;
  }
}
