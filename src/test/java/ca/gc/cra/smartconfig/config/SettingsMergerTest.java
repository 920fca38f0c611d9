package ca.gc.cra.smartconfig.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SettingsMergerTest {

  @Test
  void cliOverridesYamlOverridesDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> defaults = DefaultsForCommand.asFlatMap("commit");
    Map<String, String> yaml = Map.of("historyDir", "/yaml/history", "author", "yaml-user");
    Map<String, String> cli = Map.of("historyDir", "/cli/history", "files", "a.yaml");

    Map<String, String> merged = SettingsMerger.buildEffectiveSettings(
        "commit", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("/cli/history", merged.get("historyDir"));
    assertEquals("yaml-user", merged.get("author"));
    assertEquals("5000", merged.get("lockTimeoutMs"));
    assertEquals("a.yaml", merged.get("files"));
    assertEquals(List.of("CLI overrides YAML for key: historyDir"), warnings);
  }

  @Test
  void missingYamlUsesDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = SettingsMerger.buildEffectiveSettings(
        "prune", Optional.empty(), Map.of(), DefaultsForCommand.asFlatMap("prune"), warnings::add);

    assertEquals("10", merged.get("keep"));
    assertTrue(warnings.isEmpty());
  }
}
