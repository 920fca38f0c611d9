package ca.gc.cra.smartconfig.domain.error;

/**
 * Root of the typed failures raised by the configuration core.
 *
 * <p>Unchecked so pure tree operations stay free of {@code throws} clauses; CLI entry points translate each
 * subtype into an exit code.</p>
 *
 * @since 0.1.0
 */
public abstract class ConfigException extends RuntimeException {

  protected ConfigException(String message) {
    super(message);
  }

  protected ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
