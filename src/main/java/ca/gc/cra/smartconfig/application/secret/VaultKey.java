package ca.gc.cra.smartconfig.application.secret;

import ca.gc.cra.smartconfig.domain.error.VaultException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * 256-bit AES key used by {@link SecretVault}. Never part of a configuration document.
 *
 * @since 0.1.0
 */
public final class VaultKey {
  /** Key length in bytes. */
  public static final int KEY_BYTES = 32;
  /** Salt applied when a passphrase is supplied without one. */
  public static final String DEFAULT_SALT = "smartconfig-vault";

  private static final String KDF = "PBKDF2WithHmacSHA256";
  private static final int KDF_ITERATIONS = 65_536;

  private final SecretKey secretKey;

  private VaultKey(SecretKey secretKey) {
    this.secretKey = secretKey;
  }

  /**
   * Wraps raw key material.
   *
   * @param keyBytes exactly {@value #KEY_BYTES} bytes; copied
   * @return key
   * @throws VaultException when the length is wrong
   */
  public static VaultKey fromBytes(byte[] keyBytes) {
    Objects.requireNonNull(keyBytes, "keyBytes");
    if (keyBytes.length != KEY_BYTES) {
      throw new VaultException("vault key must be 256 bits (32 bytes), got " + keyBytes.length + " bytes");
    }
    return new VaultKey(new SecretKeySpec(Arrays.copyOf(keyBytes, KEY_BYTES), "AES"));
  }

  /**
   * Decodes a Base64 key such as the output of {@code openssl rand -base64 32}.
   *
   * @param base64 encoded key; surrounding whitespace is ignored
   * @param source label naming where the key came from, used in error messages
   * @return key
   * @throws VaultException when the text is not Base64 or has the wrong length
   */
  public static VaultKey fromBase64(String base64, String source) {
    Objects.requireNonNull(base64, "base64");
    byte[] decoded;
    try {
      decoded = Base64.getDecoder().decode(base64.trim());
    } catch (IllegalArgumentException ex) {
      throw new VaultException(source + " must be valid Base64", ex);
    }
    try {
      return fromBytes(decoded);
    } catch (VaultException ex) {
      throw new VaultException(source + ": " + ex.getMessage(), ex);
    } finally {
      Arrays.fill(decoded, (byte) 0);
    }
  }

  /**
   * Derives a key from a passphrase with PBKDF2-HMAC-SHA256.
   *
   * @param passphrase passphrase characters
   * @param salt salt text; {@link #DEFAULT_SALT} when {@code null} or blank
   * @return derived key
   */
  public static VaultKey derive(char[] passphrase, String salt) {
    Objects.requireNonNull(passphrase, "passphrase");
    if (passphrase.length == 0) {
      throw new VaultException("passphrase must not be empty");
    }
    String effectiveSalt = salt == null || salt.isBlank() ? DEFAULT_SALT : salt;
    PBEKeySpec keySpec = new PBEKeySpec(
        passphrase, effectiveSalt.getBytes(StandardCharsets.UTF_8), KDF_ITERATIONS, KEY_BYTES * 8);
    try {
      SecretKeyFactory factory = SecretKeyFactory.getInstance(KDF);
      byte[] derived = factory.generateSecret(keySpec).getEncoded();
      try {
        return fromBytes(derived);
      } finally {
        Arrays.fill(derived, (byte) 0);
      }
    } catch (GeneralSecurityException ex) {
      throw new VaultException("failed to derive vault key", ex);
    } finally {
      keySpec.clearPassword();
    }
  }

  SecretKey secretKey() {
    return secretKey;
  }

  @Override
  public String toString() {
    return "VaultKey[AES-256]";
  }
}
