package ca.gc.cra.smartconfig.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * <strong>What:</strong> Narrow, file-backed persistence for encoded history records.
 * <p><strong>Why:</strong> The history service owns sequencing, hashing and validation; the store only keeps
 * an ordered list of opaque records durable and offers an exclusive lock.</p>
 * <p><strong>Contract:</strong> {@link #writeRecords(List)} replaces the log atomically; readers never see a
 * half-written log.</p>
 *
 * @since 0.1.0
 */
public interface HistoryStorePort {
  /**
   * Reads every record, oldest first. A missing log reads as empty.
   *
   * @return encoded records
   * @throws IOException when the log cannot be read
   */
  List<String> readRecords() throws IOException;

  /**
   * Atomically replaces the log with {@code records}.
   *
   * @param records encoded records, oldest first
   * @throws IOException when the log cannot be written
   */
  void writeRecords(List<String> records) throws IOException;

  /**
   * Copies the current log aside so a damaged history is preserved before it is repaired.
   *
   * @return location of the preserved copy, or {@code null} when there was no log
   * @throws IOException when the copy fails
   */
  Path preserveCorruptLog() throws IOException;

  /**
   * Acquires the exclusive store lock, waiting at most {@code timeout}.
   *
   * @param timeout maximum wait
   * @return held lock; close to release
   * @throws IOException when the lock file cannot be opened
   * @throws ca.gc.cra.smartconfig.domain.error.LockTimeoutException when the wait elapses
   */
  StoreLock lock(Duration timeout) throws IOException;

  /**
   * Describes the backing location for logs and diagnostics.
   *
   * @return location label
   */
  String location();

  /** Held exclusive lock on the store. */
  interface StoreLock extends AutoCloseable {
    @Override
    void close() throws IOException;
  }
}
