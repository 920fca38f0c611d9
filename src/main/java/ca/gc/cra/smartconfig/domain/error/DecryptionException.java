package ca.gc.cra.smartconfig.domain.error;

/**
 * A sensitive field could not be decrypted: wrong key, tampered ciphertext or malformed envelope.
 *
 * @since 0.1.0
 */
public final class DecryptionException extends VaultException {
  private final String path;

  public DecryptionException(String path, String reason, Throwable cause) {
    super("Failed to decrypt sensitive field " + path + ": " + reason, cause);
    this.path = path;
  }

  public String path() {
    return path;
  }
}
