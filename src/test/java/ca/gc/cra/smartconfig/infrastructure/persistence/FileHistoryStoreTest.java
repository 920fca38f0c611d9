package ca.gc.cra.smartconfig.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.smartconfig.application.port.FixedClock;
import ca.gc.cra.smartconfig.application.port.HistoryStorePort;
import ca.gc.cra.smartconfig.domain.error.LockTimeoutException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileHistoryStoreTest {
  @TempDir Path tempDir;

  @Test
  void missingLogReadsAsEmpty() throws IOException {
    FileHistoryStore store = new FileHistoryStore(tempDir.resolve("none"));

    assertEquals(List.of(), store.readRecords());
    assertNull(store.preserveCorruptLog());
  }

  @Test
  void writeReplacesRecordsAndSkipsBlankLines() throws IOException {
    FileHistoryStore store = new FileHistoryStore(tempDir);
    store.writeRecords(List.of("{\"a\":1}", "{\"b\":2}"));
    Files.writeString(tempDir.resolve(FileHistoryStore.LOG_FILE), "{\"a\":1}\n\n{\"b\":2}\n");

    assertEquals(List.of("{\"a\":1}", "{\"b\":2}"), store.readRecords());

    store.writeRecords(List.of("{\"c\":3}"));
    assertEquals(List.of("{\"c\":3}"), store.readRecords());
  }

  @Test
  void multiLineRecordsAreRefused() {
    FileHistoryStore store = new FileHistoryStore(tempDir);

    assertThrows(IllegalArgumentException.class, () -> store.writeRecords(List.of("a\nb")));
  }

  @Test
  void corruptLogCopyIsStampedWithClock() throws IOException {
    FileHistoryStore store = new FileHistoryStore(tempDir, new FixedClock(42L));
    store.writeRecords(List.of("garbage"));

    Path copy = store.preserveCorruptLog();

    assertEquals(FileHistoryStore.LOG_FILE + ".corrupt-42", copy.getFileName().toString());
    assertEquals("garbage\n", Files.readString(copy));
  }

  @Test
  void secondLockTimesOutUntilFirstIsReleased() throws IOException {
    FileHistoryStore first = new FileHistoryStore(tempDir);
    FileHistoryStore second = new FileHistoryStore(tempDir);

    try (HistoryStorePort.StoreLock lock = first.lock(Duration.ofSeconds(1))) {
      LockTimeoutException ex = assertThrows(LockTimeoutException.class, () -> second.lock(Duration.ofMillis(100)));
      assertEquals(tempDir.toString(), ex.location());
    }
    try (HistoryStorePort.StoreLock lock = second.lock(Duration.ofMillis(100))) {
      assertTrue(Files.exists(tempDir.resolve(FileHistoryStore.LOCK_FILE)));
    }
  }
}
