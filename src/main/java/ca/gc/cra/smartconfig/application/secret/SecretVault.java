package ca.gc.cra.smartconfig.application.secret;

import ca.gc.cra.smartconfig.application.port.MetricsPort;
import ca.gc.cra.smartconfig.domain.error.DecryptionException;
import ca.gc.cra.smartconfig.domain.error.VaultException;
import ca.gc.cra.smartconfig.domain.secret.SensitiveFieldMarker;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.SequenceValue;
import ca.gc.cra.smartconfig.domain.tree.StringValue;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encrypts and decrypts the sensitive string fields of a configuration tree with AES-256-GCM.
 *
 * <p>Encrypted fields are stored as {@code enc:v1:<nonce>:<ciphertext>} (both parts unpadded Base64url).
 * The dotted key path of the field is bound as associated data, so a ciphertext moved to another field no
 * longer decrypts. Values that already are well-formed envelopes are left alone, which makes encryption
 * idempotent. Plaintext that only looks like the prefix is encrypted like any other value.</p>
 *
 * <p>Instances are stateless apart from the shared {@link SecureRandom} and may be reused across threads.</p>
 *
 * @since 0.1.0
 */
public final class SecretVault {
  /** Prefix identifying an encrypted value. */
  public static final String PREFIX = "enc:v1:";

  private static final Logger log = LoggerFactory.getLogger(SecretVault.class);
  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int GCM_IV_LENGTH = 12;
  private static final int GCM_TAG_LENGTH = 128; // bits
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private final MetricsPort metrics;

  public SecretVault() {
    this(MetricsPort.NO_OP);
  }

  public SecretVault(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Indicates whether a string already carries the encrypted representation.
   *
   * <p>Only the complete envelope counts: the prefix, then two Base64url parts decoding to a 12-byte nonce
   * and a body at least as long as the GCM tag. Plaintext that merely starts with {@link #PREFIX} is not
   * encrypted.</p>
   *
   * @param text candidate value
   * @return {@code true} when the value is a well-formed envelope
   */
  public static boolean isEncrypted(String text) {
    if (text == null || !text.startsWith(PREFIX)) {
      return false;
    }
    String body = text.substring(PREFIX.length());
    int separator = body.indexOf(':');
    if (separator <= 0 || separator == body.length() - 1 || body.indexOf(':', separator + 1) >= 0) {
      return false;
    }
    try {
      return DECODER.decode(body.substring(0, separator)).length == GCM_IV_LENGTH
          && DECODER.decode(body.substring(separator + 1)).length >= GCM_TAG_LENGTH / 8;
    } catch (IllegalArgumentException ex) {
      log.trace("Value with envelope prefix is not Base64url: {}", ex.getMessage());
      return false;
    }
  }

  /**
   * Encrypts every sensitive string field that is not already encrypted.
   *
   * @param tree tree to protect
   * @param markers sensitive-field designations
   * @param key vault key
   * @return tree with sensitive fields encrypted
   */
  public MappingValue encryptFields(MappingValue tree, SensitiveFieldMarker markers, VaultKey key) {
    return encryptFields(tree, markers, key, null);
  }

  /**
   * Encrypts sensitive fields, reusing the ciphertext stored in {@code baseline} when a field's plaintext is
   * unchanged. Keeps unchanged secrets byte-identical across snapshots.
   *
   * @param tree tree to protect
   * @param markers sensitive-field designations
   * @param key vault key
   * @param baseline previously stored (encrypted) tree, may be {@code null}
   * @return tree with sensitive fields encrypted
   */
  public MappingValue encryptFields(
      MappingValue tree, SensitiveFieldMarker markers, VaultKey key, MappingValue baseline) {
    Objects.requireNonNull(key, "key");
    int[] count = {0};
    MappingValue result = (MappingValue) transform(tree, FieldPath.ROOT, markers, (path, text) -> {
      if (isEncrypted(text)) {
        return text;
      }
      count[0]++;
      Optional<String> reused = reusable(baseline, path, text, key);
      return reused.orElseGet(() -> encrypt(text, path, key));
    });
    log.debug("Encrypted {} sensitive field(s)", count[0]);
    return result;
  }

  /**
   * Decrypts every encrypted sensitive field.
   *
   * @param tree tree holding encrypted values
   * @param markers sensitive-field designations
   * @param key vault key
   * @return tree with plaintext sensitive fields
   * @throws DecryptionException when a value fails authentication (wrong key or tampering); names the path only
   */
  public MappingValue decryptFields(MappingValue tree, SensitiveFieldMarker markers, VaultKey key) {
    Objects.requireNonNull(key, "key");
    return (MappingValue) transform(tree, FieldPath.ROOT, markers, (path, text) -> {
      if (!isEncrypted(text)) {
        return text;
      }
      try {
        return decrypt(text, path, key);
      } catch (DecryptionException ex) {
        metrics.increment("config.vault.decrypt.failure");
        throw ex;
      }
    });
  }

  /**
   * Lists sensitive string fields that are still in plaintext.
   *
   * @param tree tree to inspect
   * @param markers sensitive-field designations
   * @return offending paths in tree order
   */
  public List<FieldPath> plaintextSecrets(ConfigValue tree, SensitiveFieldMarker markers) {
    List<FieldPath> found = new ArrayList<>();
    transform(tree, FieldPath.ROOT, markers, (path, text) -> {
      if (!isEncrypted(text)) {
        found.add(path);
      }
      return text;
    });
    return found;
  }

  /**
   * Replaces every sensitive string field, encrypted or not, with {@code mask}'s result.
   *
   * @param tree tree to mask
   * @param markers sensitive-field designations
   * @param mask replacement for each sensitive value
   * @return masked tree
   */
  public MappingValue maskFields(MappingValue tree, SensitiveFieldMarker markers, UnaryOperator<String> mask) {
    Objects.requireNonNull(mask, "mask");
    return (MappingValue) transform(tree, FieldPath.ROOT, markers, (path, text) -> mask.apply(text));
  }

  private Optional<String> reusable(MappingValue baseline, FieldPath path, String plaintext, VaultKey key) {
    if (baseline == null) {
      return Optional.empty();
    }
    Optional<ConfigValue> previous = baseline.lookup(path);
    if (previous.isEmpty() || !(previous.get() instanceof StringValue stored) || !isEncrypted(stored.value())) {
      return Optional.empty();
    }
    try {
      return plaintext.equals(decrypt(stored.value(), path, key))
          ? Optional.of(stored.value())
          : Optional.empty();
    } catch (DecryptionException ex) {
      log.debug("Baseline ciphertext at {} not reusable: {}", path, ex.getMessage());
      return Optional.empty();
    }
  }

  private static String encrypt(String plaintext, FieldPath path, VaultKey key) {
    try {
      byte[] iv = new byte[GCM_IV_LENGTH];
      SECURE_RANDOM.nextBytes(iv);
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key.secretKey(), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      cipher.updateAAD(associatedData(path));
      byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      return PREFIX + ENCODER.encodeToString(iv) + ":" + ENCODER.encodeToString(ciphertext);
    } catch (GeneralSecurityException ex) {
      throw new VaultException("Failed to encrypt field " + path, ex);
    }
  }

  // Callers check isEncrypted first, so the envelope is well formed here.
  private static String decrypt(String stored, FieldPath path, VaultKey key) {
    String body = stored.substring(PREFIX.length());
    int separator = body.indexOf(':');
    byte[] iv = DECODER.decode(body.substring(0, separator));
    byte[] ciphertext = DECODER.decode(body.substring(separator + 1));
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key.secretKey(), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      cipher.updateAAD(associatedData(path));
      byte[] plaintext = cipher.doFinal(ciphertext);
      return new String(plaintext, StandardCharsets.UTF_8);
    } catch (AEADBadTagException ex) {
      throw new DecryptionException(path.toString(), "authentication failed (wrong key or tampered value)", ex);
    } catch (GeneralSecurityException ex) {
      throw new DecryptionException(path.toString(), "decryption failed", ex);
    }
  }

  private static byte[] associatedData(FieldPath path) {
    return String.join(".", path.keys()).getBytes(StandardCharsets.UTF_8);
  }

  private static ConfigValue transform(
      ConfigValue value, FieldPath path, SensitiveFieldMarker markers, LeafTransformer transformer) {
    if (value instanceof MappingValue mapping) {
      Map<String, ConfigValue> out = new LinkedHashMap<>();
      mapping.entries().forEach((k, v) -> out.put(k, transform(v, path.child(k), markers, transformer)));
      return new MappingValue(out);
    }
    if (value instanceof SequenceValue sequence) {
      List<ConfigValue> out = new ArrayList<>(sequence.size());
      for (int i = 0; i < sequence.size(); i++) {
        out.add(transform(sequence.get(i), path.index(i), markers, transformer));
      }
      return new SequenceValue(out);
    }
    if (value instanceof StringValue text && !path.isRoot() && markers.matches(path)) {
      return StringValue.of(transformer.apply(path, text.value()));
    }
    return value;
  }

  @FunctionalInterface
  private interface LeafTransformer {
    String apply(FieldPath path, String text);
  }
}
