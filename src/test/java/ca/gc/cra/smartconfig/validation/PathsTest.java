package ca.gc.cra.smartconfig.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void parseNormalizes() {
    assertEquals(Path.of("conf/app.yaml"), Paths.parse("file", "conf/./x/../app.yaml"));
    assertThrows(IllegalArgumentException.class, () -> Paths.parse("file", " "));
  }

  @Test
  void readableFileChecks() throws IOException {
    Path file = Files.writeString(tempDir.resolve("app.yaml"), "a: 1\n");

    assertEquals(file, Paths.validateReadableFile("file", file));
    IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateReadableFile("file", tempDir.resolve("absent.yaml")));
    assertTrue(missing.getMessage().startsWith("file does not exist"));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile("file", tempDir));
  }
}
