package ca.gc.cra.smartconfig.infrastructure.secret;

import ca.gc.cra.smartconfig.application.secret.VaultKey;
import ca.gc.cra.smartconfig.domain.error.VaultException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves the vault key from a key file, a Base64 environment variable or a passphrase
 * environment variable, in that order.
 * <p><strong>Role:</strong> Infrastructure adapter feeding {@link VaultKey} to the encrypt, decrypt and commit
 * commands.</p>
 * <p><strong>Security:</strong> Key material is never logged; only the name of the source is.</p>
 *
 * @since 0.1.0
 */
public final class VaultKeyLoader {
  private static final Logger log = LoggerFactory.getLogger(VaultKeyLoader.class);
  private static final Set<PosixFilePermission> GROUP_OR_OTHER = EnumSet.of(
      PosixFilePermission.GROUP_READ,
      PosixFilePermission.GROUP_WRITE,
      PosixFilePermission.OTHERS_READ,
      PosixFilePermission.OTHERS_WRITE);

  private final Function<String, String> env;

  /**
   * Creates a loader reading the process environment.
   */
  public VaultKeyLoader() {
    this(System::getenv);
  }

  /**
   * Creates a loader reading variables through {@code env}.
   *
   * @param env environment lookup
   */
  public VaultKeyLoader(Function<String, String> env) {
    this.env = Objects.requireNonNull(env, "env");
  }

  /**
   * Where to look for the key.
   *
   * @param keyFile optional file holding Base64 text or 32 raw bytes
   * @param keyEnv name of the variable holding a Base64 key
   * @param passphraseEnv name of the variable holding a passphrase
   * @param salt salt for passphrase derivation; {@link VaultKey#DEFAULT_SALT} when blank
   */
  public record KeySource(Path keyFile, String keyEnv, String passphraseEnv, String salt) {}

  /**
   * Loads the key from the first configured source that is present.
   *
   * @param source key locations
   * @return the key, or empty when no source is configured or set
   * @throws IOException when the key file cannot be read
   * @throws VaultException when the key material is malformed
   */
  public Optional<VaultKey> load(KeySource source) throws IOException {
    Objects.requireNonNull(source, "source");
    if (source.keyFile() != null) {
      return Optional.of(fromFile(source.keyFile()));
    }
    String encoded = lookup(source.keyEnv());
    if (encoded != null) {
      log.debug("Vault key taken from environment variable {}", source.keyEnv());
      return Optional.of(VaultKey.fromBase64(encoded, source.keyEnv()));
    }
    String passphrase = lookup(source.passphraseEnv());
    if (passphrase != null) {
      log.debug("Vault key derived from passphrase in environment variable {}", source.passphraseEnv());
      char[] chars = passphrase.toCharArray();
      try {
        return Optional.of(VaultKey.derive(chars, source.salt()));
      } finally {
        Arrays.fill(chars, '\0');
      }
    }
    return Optional.empty();
  }

  /**
   * Loads the key or fails with a message naming the sources that were tried.
   *
   * @param source key locations
   * @return the key
   * @throws IOException when the key file cannot be read
   * @throws VaultException when no source yields a key
   */
  public VaultKey require(KeySource source) throws IOException {
    return load(source).orElseThrow(() -> new VaultException(
        "no vault key configured: set " + source.keyEnv() + " or " + source.passphraseEnv()
            + ", or pass keyFile=PATH"));
  }

  private VaultKey fromFile(Path keyFile) throws IOException {
    warnIfShared(keyFile);
    byte[] content = Files.readAllBytes(keyFile);
    try {
      if (content.length == VaultKey.KEY_BYTES) {
        log.debug("Vault key read as raw bytes from {}", keyFile);
        return VaultKey.fromBytes(content);
      }
      log.debug("Vault key read as Base64 from {}", keyFile);
      return VaultKey.fromBase64(new String(content, StandardCharsets.US_ASCII), "key file " + keyFile);
    } finally {
      Arrays.fill(content, (byte) 0);
    }
  }

  private void warnIfShared(Path keyFile) throws IOException {
    PosixFileAttributeView view = Files.getFileAttributeView(keyFile, PosixFileAttributeView.class);
    if (view == null) {
      return;
    }
    Set<PosixFilePermission> permissions = view.readAttributes().permissions();
    for (PosixFilePermission permission : GROUP_OR_OTHER) {
      if (permissions.contains(permission)) {
        log.warn("Key file {} is accessible by group or others; restrict it to the owner", keyFile);
        return;
      }
    }
  }

  private String lookup(String name) {
    if (name == null || name.isBlank()) {
      return null;
    }
    String value = env.apply(name);
    return value == null || value.isBlank() ? null : value;
  }
}
