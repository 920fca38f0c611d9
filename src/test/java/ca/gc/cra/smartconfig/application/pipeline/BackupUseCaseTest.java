package ca.gc.cra.smartconfig.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.smartconfig.application.port.FixedClock;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BackupUseCaseTest {
  @TempDir Path tempDir;

  private final BackupUseCase backups = new BackupUseCase(new FixedClock(1_700_000_000_000L), ZoneOffset.UTC);

  @Test
  void copiesIntoTimestampedFileNextToSource() throws IOException {
    Path source = tempDir.resolve("app.yaml");
    Files.writeString(source, "a: 1\n", StandardCharsets.UTF_8);

    Path copy = backups.backup(source, Path.of("backups"));

    assertEquals(tempDir.resolve("backups").resolve("app_20231114_221320.yaml"), copy);
    assertEquals("a: 1\n", Files.readString(copy));
  }

  @Test
  void successiveBackupsGetDistinctNames() throws IOException {
    Path source = tempDir.resolve("settings");
    Files.writeString(source, "x", StandardCharsets.UTF_8);
    Path dir = tempDir.resolve("abs");

    Path first = backups.backup(source, dir);
    Path second = backups.backup(source, dir);

    assertNotEquals(first, second);
    assertEquals("settings_20231114_221320", first.getFileName().toString());
  }

  @Test
  void missingSourceFails() {
    assertThrows(IOException.class, () -> backups.backup(tempDir.resolve("absent.yaml"), tempDir));
  }
}
