package ca.gc.cra.smartconfig.domain.error;

import ca.gc.cra.smartconfig.domain.tree.ConfigFormat;

/**
 * A tree that the target format cannot express.
 *
 * @since 0.1.0
 */
public final class SerializationException extends ConfigException {
  private final ConfigFormat format;
  private final String path;

  public SerializationException(ConfigFormat format, String path, String detail) {
    this(format, path, detail, null);
  }

  public SerializationException(ConfigFormat format, String path, String detail, Throwable cause) {
    super("Cannot serialize " + path + " as " + format + ": " + detail, cause);
    this.format = format;
    this.path = path;
  }

  public ConfigFormat format() {
    return format;
  }

  public String path() {
    return path;
  }
}
