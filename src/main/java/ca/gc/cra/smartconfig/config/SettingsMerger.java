package ca.gc.cra.smartconfig.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges settings from defaults, YAML and CLI sources while enforcing precedence.
 */
public final class SettingsMerger {

  private SettingsMerger() {}

  /**
   * Builds an effective settings map using precedence CLI &gt; YAML &gt; defaults.
   *
   * <p>Keys unknown to the defaults are kept: commands read their own arguments (such as {@code out} or
   * {@code schema}) from the same map.</p>
   *
   * @param command active CLI command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value arguments (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged settings map
   */
  public static Map<String, String> buildEffectiveSettings(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }
    return Map.copyOf(merged);
  }
}
