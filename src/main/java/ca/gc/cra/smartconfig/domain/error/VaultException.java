package ca.gc.cra.smartconfig.domain.error;

/**
 * Cryptographic failure in the secret vault. Messages name field paths only, never values.
 *
 * @since 0.1.0
 */
public class VaultException extends ConfigException {

  public VaultException(String message) {
    super(message);
  }

  public VaultException(String message, Throwable cause) {
    super(message, cause);
  }
}
