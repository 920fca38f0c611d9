package ca.gc.cra.smartconfig.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default settings for each smartconfig CLI command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI arguments.</p>
 */
public final class DefaultsForCommand {
  /** Commands accepted by the CLI, in help order. */
  public static final List<String> COMMANDS = List.of(
      "load", "env", "merge", "validate", "template", "encrypt", "decrypt", "backup",
      "commit", "history", "diff", "rollback", "prune");

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForCommand() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param command target CLI command
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException when the command is unknown
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    if (!COMMANDS.contains(normalized)) {
      throw new IllegalArgumentException("Unsupported command: " + command);
    }
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "validate", "commit", "template" -> Map.of("requiredOnly", "false");
      case "history" -> Map.of("limit", "0");
      case "prune" -> Map.of("keep", "10");
      default -> Map.of();
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("historyDir", ToolSettings.DEFAULT_HISTORY_DIR);
    map.put("lockTimeoutMs", "5000");
    map.put("keyEnv", "SMARTCONFIG_KEY");
    map.put("keyFile", "");
    map.put("passphraseEnv", "SMARTCONFIG_PASSPHRASE");
    map.put("keySalt", "");
    map.put("secretSuffixes", "_secret");
    map.put("secretPaths", "");
    map.put("secretKeys", "");
    map.put("strict", "false");
    map.put("author", System.getProperty("user.name", ""));
    map.put("format", "");
    map.put("scalarPrecedence", "HIGHEST_WINS");
    map.put("sequenceStrategy", "REPLACE");
    map.put("backupDir", "backups");
    map.put("metricsExporter", "");
    map.put("otelEndpoint", "");
    return Map.copyOf(map);
  }
}
