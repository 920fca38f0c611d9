package ca.gc.cra.smartconfig.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SettingsLoaderTest {
  @TempDir Path tempDir;

  private Path write(String yaml) throws IOException {
    return Files.writeString(tempDir.resolve("smartconfig.yaml"), yaml);
  }

  @Test
  void commandSectionOverridesCommon() throws IOException {
    Path file = write(String.join("\n",
        "common:",
        "  historyDir: /var/lib/smartconfig",
        "  lockTimeoutMs: 1000",
        "  secretSuffixes: [_secret, _token]",
        "commit:",
        "  lockTimeoutMs: 2500",
        "  author: ci",
        "prune:",
        "  keep: 3",
        ""));

    Map<String, String> commit = SettingsLoader.load(file, "commit").orElseThrow();

    assertEquals("/var/lib/smartconfig", commit.get("historyDir"));
    assertEquals("2500", commit.get("lockTimeoutMs"));
    assertEquals("_secret,_token", commit.get("secretSuffixes"));
    assertEquals("ci", commit.get("author"));
    assertFalse(commit.containsKey("keep"));
  }

  @Test
  void nestedKeysFlattenWithDots() throws IOException {
    Path file = write("common:\n  otel:\n    endpoint: http://collector:4317\n");

    assertEquals("http://collector:4317",
        SettingsLoader.load(file, "load").orElseThrow().get("otel.endpoint"));
  }

  @Test
  void missingFileYieldsEmpty() throws IOException {
    assertTrue(SettingsLoader.load(tempDir.resolve("absent.yaml"), "load").isEmpty());
  }

  @Test
  void emptyFileYieldsNoSettings() throws IOException {
    assertTrue(SettingsLoader.load(write(""), "load").orElseThrow().isEmpty());
  }

  @Test
  void invalidStructureRejected() throws IOException {
    Path scalarRoot = write("just text\n");
    assertThrows(IllegalArgumentException.class, () -> SettingsLoader.load(scalarRoot, "load"));

    Path commaItem = write("common:\n  secretKeys: [\"a,b\"]\n");
    assertThrows(IllegalArgumentException.class, () -> SettingsLoader.load(commaItem, "load"));

    Path broken = write("common: [\n");
    assertThrows(IllegalArgumentException.class, () -> SettingsLoader.load(broken, "load"));
  }
}
