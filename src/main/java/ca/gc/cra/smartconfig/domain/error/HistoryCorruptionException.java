package ca.gc.cra.smartconfig.domain.error;

/**
 * The persisted history log is not a contiguous, verifiable sequence of snapshots.
 *
 * @since 0.1.0
 */
public final class HistoryCorruptionException extends ConfigException {
  private final int recordIndex;

  public HistoryCorruptionException(int recordIndex, String detail) {
    this(recordIndex, detail, null);
  }

  public HistoryCorruptionException(int recordIndex, String detail, Throwable cause) {
    super("History corrupted at record " + (recordIndex + 1) + ": " + detail, cause);
    this.recordIndex = recordIndex;
  }

  /**
   * Returns the zero-based position of the first bad record in the log.
   *
   * @return record index
   */
  public int recordIndex() {
    return recordIndex;
  }
}
