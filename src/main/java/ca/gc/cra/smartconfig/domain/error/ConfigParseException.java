package ca.gc.cra.smartconfig.domain.error;

/**
 * Raised when source text cannot be turned into a configuration document. Existing state is never touched.
 *
 * @since 0.1.0
 */
public abstract class ConfigParseException extends ConfigException {
  private final String origin;

  protected ConfigParseException(String origin, String message, Throwable cause) {
    super(origin + ": " + message, cause);
    this.origin = origin;
  }

  /**
   * Returns the path or logical name of the document that failed to parse.
   *
   * @return origin identifier
   */
  public String origin() {
    return origin;
  }
}
