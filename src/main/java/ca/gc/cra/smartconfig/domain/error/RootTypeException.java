package ca.gc.cra.smartconfig.domain.error;

import ca.gc.cra.smartconfig.domain.tree.ValueKind;

/**
 * The document root parsed to something other than a mapping.
 *
 * @since 0.1.0
 */
public final class RootTypeException extends ConfigParseException {
  private final ValueKind actual;

  public RootTypeException(String origin, ValueKind actual) {
    super(origin, "document root must be a mapping but was " + actual.label(), null);
    this.actual = actual;
  }

  public ValueKind actual() {
    return actual;
  }
}
