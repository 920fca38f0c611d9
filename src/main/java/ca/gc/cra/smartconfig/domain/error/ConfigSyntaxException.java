package ca.gc.cra.smartconfig.domain.error;

/**
 * Malformed source text. Carries the 1-based line and column when the parser reports them, otherwise the key
 * path at which the problem was detected.
 *
 * @since 0.1.0
 */
public final class ConfigSyntaxException extends ConfigParseException {
  private final int line;
  private final int column;
  private final String keyPath;

  /**
   * Creates a syntax error positioned at a line and column.
   *
   * @param origin document origin
   * @param line 1-based line, or {@code -1} when unknown
   * @param column 1-based column, or {@code -1} when unknown
   * @param detail parser message
   * @param cause parser exception, may be {@code null}
   */
  public ConfigSyntaxException(String origin, int line, int column, String detail, Throwable cause) {
    super(origin, describe(line, column, detail), cause);
    this.line = line;
    this.column = column;
    this.keyPath = null;
  }

  /**
   * Creates a syntax error positioned at a key path.
   *
   * @param origin document origin
   * @param keyPath rendered key path
   * @param detail parser message
   */
  public ConfigSyntaxException(String origin, String keyPath, String detail) {
    super(origin, "at " + keyPath + ": " + detail, null);
    this.line = -1;
    this.column = -1;
    this.keyPath = keyPath;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  /**
   * Returns the key path context, when the error was reported by path rather than position.
   *
   * @return key path or {@code null}
   */
  public String keyPath() {
    return keyPath;
  }

  private static String describe(int line, int column, String detail) {
    if (line < 0) {
      return detail;
    }
    return "line " + line + (column >= 0 ? ", column " + column : "") + ": " + detail;
  }
}
