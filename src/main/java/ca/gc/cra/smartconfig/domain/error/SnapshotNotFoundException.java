package ca.gc.cra.smartconfig.domain.error;

/**
 * A history operation referenced a sequence number that the store does not hold.
 *
 * @since 0.1.0
 */
public final class SnapshotNotFoundException extends ConfigException {
  private final long sequence;

  public SnapshotNotFoundException(long sequence) {
    super("No snapshot with sequence #" + sequence);
    this.sequence = sequence;
  }

  public long sequence() {
    return sequence;
  }
}
