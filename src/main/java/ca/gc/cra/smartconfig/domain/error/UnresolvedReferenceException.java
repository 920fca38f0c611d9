package ca.gc.cra.smartconfig.domain.error;

/**
 * A {@code ${NAME}} placeholder referenced an unset environment variable and declared no default.
 *
 * @since 0.1.0
 */
public final class UnresolvedReferenceException extends ConfigException {
  private final String path;
  private final String variable;

  public UnresolvedReferenceException(String path, String variable) {
    super("Unresolved environment reference ${" + variable + "} at " + path);
    this.path = path;
    this.variable = variable;
  }

  /**
   * Creates an error for a placeholder that could not be parsed.
   *
   * @param path field path
   * @param variable partial variable text
   * @param detail description of the problem
   */
  public UnresolvedReferenceException(String path, String variable, String detail) {
    super(detail + " at " + path);
    this.path = path;
    this.variable = variable;
  }

  public String path() {
    return path;
  }

  public String variable() {
    return variable;
  }
}
