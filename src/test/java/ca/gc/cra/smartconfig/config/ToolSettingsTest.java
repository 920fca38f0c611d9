package ca.gc.cra.smartconfig.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.smartconfig.domain.error.UnsupportedFormatException;
import ca.gc.cra.smartconfig.domain.merge.MergePolicy;
import ca.gc.cra.smartconfig.domain.tree.ConfigFormat;
import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolSettingsTest {

  private static Map<String, String> options(String... pairs) {
    Map<String, String> map = new HashMap<>(DefaultsForCommand.asFlatMap("commit"));
    for (int i = 0; i < pairs.length; i += 2) {
      map.put(pairs[i], pairs[i + 1]);
    }
    return map;
  }

  @Test
  void defaultsAreUsable() {
    ToolSettings settings = ToolSettings.defaults();

    assertEquals(Path.of(ToolSettings.DEFAULT_HISTORY_DIR), settings.historyDir());
    assertEquals(Duration.ofMillis(5000), settings.lockTimeout());
    assertTrue(settings.keyFile().isEmpty());
    assertTrue(settings.format().isEmpty());
    assertEquals(MergePolicy.DEFAULT, settings.mergePolicy());
    assertTrue(settings.markers().matches(FieldPath.parse("db.password_secret")));
    assertFalse(settings.strict());
  }

  @Test
  void parsesExplicitValues() {
    ToolSettings settings = ToolSettings.fromMap(options(
        "lockTimeoutMs", "250",
        "keyFile", "/etc/smartconfig/vault.key",
        "secretKeys", "password,token",
        "strict", "TRUE",
        "author", " ",
        "format", "yml",
        "scalarPrecedence", "lowest_wins",
        "sequenceStrategy", "append"));

    assertEquals(Duration.ofMillis(250), settings.lockTimeout());
    assertEquals(Path.of("/etc/smartconfig/vault.key"), settings.keyFile().orElseThrow());
    assertEquals(Path.of("/etc/smartconfig/vault.key"), settings.keySource().keyFile());
    assertTrue(settings.markers().matches(FieldPath.parse("api.token")));
    assertTrue(settings.strict());
    assertNull(settings.author());
    assertEquals(ConfigFormat.YAML, settings.format().orElseThrow());
    assertEquals(MergePolicy.ScalarPrecedence.LOWEST_WINS, settings.mergePolicy().scalarPrecedence());
    assertEquals(MergePolicy.SequenceStrategy.APPEND, settings.mergePolicy().sequenceStrategy());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> ToolSettings.fromMap(options("lockTimeoutMs", "0")));
    assertThrows(IllegalArgumentException.class, () -> ToolSettings.fromMap(options("strict", "yes")));
    assertThrows(IllegalArgumentException.class,
        () -> ToolSettings.fromMap(options("scalarPrecedence", "random")));
    assertThrows(UnsupportedFormatException.class, () -> ToolSettings.fromMap(options("format", "xml")));
  }

  @Test
  void parseBooleanFallsBackOnBlank() {
    assertTrue(ToolSettings.parseBoolean("strict", "", true));
    assertFalse(ToolSettings.parseBoolean("strict", " false ", true));
  }
}
