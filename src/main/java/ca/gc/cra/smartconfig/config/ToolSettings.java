package ca.gc.cra.smartconfig.config;

import ca.gc.cra.smartconfig.domain.merge.MergePolicy;
import ca.gc.cra.smartconfig.domain.secret.SensitiveFieldMarker;
import ca.gc.cra.smartconfig.domain.tree.ConfigFormat;
import ca.gc.cra.smartconfig.infrastructure.secret.VaultKeyLoader;
import ca.gc.cra.smartconfig.validation.Numbers;
import ca.gc.cra.smartconfig.validation.Paths;
import ca.gc.cra.smartconfig.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Effective settings of one smartconfig invocation.
 * <p><strong>Role:</strong> Configuration aggregate built from the merged CLI/YAML/default map and handed to
 * {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param historyDir directory holding {@code history.ndjson} and {@code history.lock}
 * @param lockTimeout bounded wait for the history lock
 * @param keyFile optional vault key file
 * @param keyEnv environment variable holding a Base64 vault key
 * @param passphraseEnv environment variable holding a vault passphrase
 * @param keySalt salt for passphrase derivation, blank for the default
 * @param markers sensitive-field designations
 * @param strict whether schemas reject undeclared fields
 * @param author author tag recorded on commits; {@code null} when blank
 * @param format output format override
 * @param mergePolicy merge policy
 * @param backupDir backup directory, relative paths resolve next to the source file
 * @since 0.1.0
 */
public record ToolSettings(
    Path historyDir,
    Duration lockTimeout,
    Optional<Path> keyFile,
    String keyEnv,
    String passphraseEnv,
    String keySalt,
    SensitiveFieldMarker markers,
    boolean strict,
    String author,
    Optional<ConfigFormat> format,
    MergePolicy mergePolicy,
    Path backupDir) {

  /** Default history location, relative to the working directory. */
  public static final String DEFAULT_HISTORY_DIR = ".smartconfig/history";

  private static final long MAX_LOCK_TIMEOUT_MS = Duration.ofMinutes(10).toMillis();

  public ToolSettings {
    Objects.requireNonNull(historyDir, "historyDir");
    Objects.requireNonNull(lockTimeout, "lockTimeout");
    keyFile = Objects.requireNonNullElse(keyFile, Optional.empty());
    Objects.requireNonNull(markers, "markers");
    format = Objects.requireNonNullElse(format, Optional.empty());
    mergePolicy = Objects.requireNonNullElse(mergePolicy, MergePolicy.DEFAULT);
    Objects.requireNonNull(backupDir, "backupDir");
  }

  /**
   * Returns the settings produced by the embedded defaults alone.
   *
   * @return default settings
   */
  public static ToolSettings defaults() {
    return fromMap(DefaultsForCommand.asFlatMap("load"));
  }

  /**
   * Creates settings from the merged key/value map.
   *
   * @param options merged settings such as {@code historyDir}, {@code lockTimeoutMs}, {@code secretSuffixes}
   * @return populated settings
   * @throws IllegalArgumentException when a value is invalid
   */
  public static ToolSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path historyDir = Paths.parse("historyDir", valueOr(options, "historyDir", DEFAULT_HISTORY_DIR));
    long lockMillis = Numbers.parseInRange(
        "lockTimeoutMs", valueOr(options, "lockTimeoutMs", "5000"), 1, MAX_LOCK_TIMEOUT_MS);
    Optional<Path> keyFile = Optional.ofNullable(Strings.trimToNull(options.get("keyFile")))
        .map(raw -> Paths.parse("keyFile", raw));
    String keyEnv = Strings.requireNonBlank("keyEnv", valueOr(options, "keyEnv", "SMARTCONFIG_KEY"));
    String passphraseEnv = Strings.requireNonBlank(
        "passphraseEnv", valueOr(options, "passphraseEnv", "SMARTCONFIG_PASSPHRASE"));
    String keySalt = Objects.requireNonNullElse(Strings.trimToNull(options.get("keySalt")), "");

    SensitiveFieldMarker markers = SensitiveFieldMarker.of(
        Strings.splitList("secretPaths", options.get("secretPaths")),
        Strings.splitList("secretKeys", options.get("secretKeys")),
        Strings.splitList("secretSuffixes", options.get("secretSuffixes")));

    boolean strict = parseBoolean("strict", options.get("strict"), false);
    String author = Strings.trimToNull(options.get("author"));
    Optional<ConfigFormat> format = Optional.ofNullable(Strings.trimToNull(options.get("format")))
        .map(ConfigFormat::fromTag);

    MergePolicy policy;
    try {
      policy = new MergePolicy(
          MergePolicy.ScalarPrecedence.parse(valueOr(options, "scalarPrecedence", "HIGHEST_WINS")),
          MergePolicy.SequenceStrategy.parse(valueOr(options, "sequenceStrategy", "REPLACE")));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "scalarPrecedence must be HIGHEST_WINS|LOWEST_WINS and sequenceStrategy REPLACE|APPEND", ex);
    }
    Path backupDir = Paths.parse("backupDir", valueOr(options, "backupDir", "backups"));

    return new ToolSettings(
        historyDir,
        Duration.ofMillis(lockMillis),
        keyFile,
        keyEnv,
        passphraseEnv,
        keySalt,
        markers,
        strict,
        author,
        format,
        policy,
        backupDir);
  }

  /**
   * Key locations for {@link VaultKeyLoader}.
   *
   * @return key source
   */
  public VaultKeyLoader.KeySource keySource() {
    return new VaultKeyLoader.KeySource(keyFile.orElse(null), keyEnv, passphraseEnv, keySalt);
  }

  /**
   * Parses a boolean setting strictly; only {@code true} and {@code false} are accepted.
   *
   * @param name setting name for diagnostics
   * @param value raw text; blank falls back to {@code defaultValue}
   * @param defaultValue value used when {@code value} is blank
   * @return parsed boolean
   */
  static boolean parseBoolean(String name, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String trimmed = value.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    }
    if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(name + " must be true or false (was '" + trimmed + "')");
  }

  private static String valueOr(Map<String, String> options, String key, String fallback) {
    String value = Strings.trimToNull(options.get(key));
    return value == null ? fallback : value;
  }
}
