package ca.gc.cra.smartconfig.domain.error;

/**
 * A format tag or file extension that no adapter handles.
 *
 * @since 0.1.0
 */
public final class UnsupportedFormatException extends ConfigException {
  private final String tag;

  public UnsupportedFormatException(String tag) {
    super("Unsupported configuration format: " + tag);
    this.tag = tag;
  }

  public UnsupportedFormatException(String tag, String origin) {
    super("Unsupported configuration format '" + tag + "' for " + origin);
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }
}
