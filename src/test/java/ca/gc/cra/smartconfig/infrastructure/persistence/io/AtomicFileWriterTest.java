package ca.gc.cra.smartconfig.infrastructure.persistence.io;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AtomicFileWriterTest {
  @TempDir Path tempDir;

  @Test
  void createsParentsAndReplacesContent() throws IOException {
    Path target = tempDir.resolve("nested/dir/app.json");

    AtomicFileWriter.write(target, "first".getBytes(StandardCharsets.UTF_8));
    AtomicFileWriter.write(target, "second".getBytes(StandardCharsets.UTF_8));

    assertEquals("second", Files.readString(target));
  }

  @Test
  void leavesNoTemporaryFilesBehind() throws IOException {
    Path target = tempDir.resolve("app.json");

    AtomicFileWriter.write(target, new byte[0]);

    try (Stream<Path> files = Files.list(tempDir)) {
      assertEquals(1, files.count());
    }
    assertEquals(0, Files.size(target));
  }
}
