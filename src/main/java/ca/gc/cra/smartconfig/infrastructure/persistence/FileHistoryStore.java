package ca.gc.cra.smartconfig.infrastructure.persistence;

import ca.gc.cra.smartconfig.application.port.ClockPort;
import ca.gc.cra.smartconfig.application.port.HistoryStorePort;
import ca.gc.cra.smartconfig.domain.error.LockTimeoutException;
import ca.gc.cra.smartconfig.infrastructure.persistence.io.AtomicFileWriter;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link HistoryStorePort} keeping one NDJSON record per line in
 * {@code <dir>/history.ndjson}.
 * <p><strong>Concurrency:</strong> Writers serialize on an OS file lock over {@code <dir>/history.lock}; the log
 * itself is replaced atomically, so readers need no lock.</p>
 *
 * @since 0.1.0
 */
public final class FileHistoryStore implements HistoryStorePort {
  /** Log file name inside the store directory. */
  public static final String LOG_FILE = "history.ndjson";
  /** Lock file name inside the store directory. */
  public static final String LOCK_FILE = "history.lock";

  private static final Logger log = LoggerFactory.getLogger(FileHistoryStore.class);
  private static final long POLL_MILLIS = 25;

  private final Path directory;
  private final Path logFile;
  private final Path lockFile;
  private final ClockPort clock;

  public FileHistoryStore(Path directory) {
    this(directory, ClockPort.SYSTEM);
  }

  public FileHistoryStore(Path directory, ClockPort clock) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.logFile = directory.resolve(LOG_FILE);
    this.lockFile = directory.resolve(LOCK_FILE);
  }

  @Override
  public List<String> readRecords() throws IOException {
    if (!Files.exists(logFile)) {
      return List.of();
    }
    List<String> records = new ArrayList<>();
    for (String line : Files.readAllLines(logFile, StandardCharsets.UTF_8)) {
      if (!line.isBlank()) {
        records.add(line);
      }
    }
    return records;
  }

  @Override
  public void writeRecords(List<String> records) throws IOException {
    StringBuilder content = new StringBuilder();
    for (String record : records) {
      if (record.indexOf('\n') >= 0) {
        throw new IllegalArgumentException("history records must be single lines");
      }
      content.append(record).append('\n');
    }
    AtomicFileWriter.write(logFile, content.toString().getBytes(StandardCharsets.UTF_8));
    log.debug("Wrote {} history record(s) to {}", records.size(), logFile);
  }

  @Override
  public Path preserveCorruptLog() throws IOException {
    if (!Files.exists(logFile)) {
      return null;
    }
    Path copy = directory.resolve(LOG_FILE + ".corrupt-" + clock.nowMillis());
    Files.copy(logFile, copy, StandardCopyOption.REPLACE_EXISTING);
    return copy;
  }

  @Override
  public StoreLock lock(Duration timeout) throws IOException {
    Files.createDirectories(directory);
    FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
    long deadline = System.nanoTime() + timeout.toNanos();
    try {
      while (true) {
        FileLock lock = tryLock(channel);
        if (lock != null) {
          log.debug("Acquired history lock {}", lockFile);
          return () -> {
            try {
              lock.release();
            } finally {
              channel.close();
            }
          };
        }
        if (System.nanoTime() >= deadline) {
          channel.close();
          throw new LockTimeoutException(location(), timeout);
        }
        Thread.sleep(POLL_MILLIS);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      channel.close();
      InterruptedIOException interrupted = new InterruptedIOException("Interrupted waiting for " + lockFile);
      interrupted.initCause(ex);
      throw interrupted;
    } catch (IOException | RuntimeException ex) {
      if (channel.isOpen() && !(ex instanceof LockTimeoutException)) {
        channel.close();
      }
      throw ex;
    }
  }

  @Override
  public String location() {
    return directory.toString();
  }

  private static FileLock tryLock(FileChannel channel) throws IOException {
    try {
      return channel.tryLock();
    } catch (OverlappingFileLockException ex) {
      // held by another store instance in this JVM
      return null;
    }
  }
}
