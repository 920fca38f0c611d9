package ca.gc.cra.smartconfig.application.history;

import ca.gc.cra.smartconfig.application.port.ClockPort;
import ca.gc.cra.smartconfig.application.port.HistoryStorePort;
import ca.gc.cra.smartconfig.application.port.MetricsPort;
import ca.gc.cra.smartconfig.application.port.SnapshotCodec;
import ca.gc.cra.smartconfig.application.schema.SchemaValidator;
import ca.gc.cra.smartconfig.application.secret.SecretVault;
import ca.gc.cra.smartconfig.domain.error.CommitRejectedException;
import ca.gc.cra.smartconfig.domain.error.HistoryCorruptionException;
import ca.gc.cra.smartconfig.domain.error.SnapshotNotFoundException;
import ca.gc.cra.smartconfig.domain.history.FieldDelta;
import ca.gc.cra.smartconfig.domain.history.VersionSnapshot;
import ca.gc.cra.smartconfig.domain.merge.MergeResult;
import ca.gc.cra.smartconfig.domain.schema.Schema;
import ca.gc.cra.smartconfig.domain.schema.ValidationResult;
import ca.gc.cra.smartconfig.domain.secret.SensitiveFieldMarker;
import ca.gc.cra.smartconfig.domain.tree.CanonicalForm;
import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, file-backed history of committed configuration trees.
 *
 * <p>Commits validate the tree and append a snapshot while holding the store's exclusive lock, so two
 * processes committing against the same store are serialized. Reads are lock-free because the store replaces
 * its log atomically.</p>
 *
 * <p>A damaged log (unreadable record, gap, duplicate or hash mismatch) makes history reads fail with
 * {@link HistoryCorruptionException}. Commits still succeed: the damaged log is preserved beside the store,
 * the intact prefix is kept and numbering continues from its last sequence number.</p>
 *
 * @since 0.1.0
 */
public final class VersionHistory {
  /** Default bound on the wait for the store lock. */
  public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofMillis(5000);

  private static final Logger log = LoggerFactory.getLogger(VersionHistory.class);

  private final HistoryStorePort store;
  private final SnapshotCodec codec;
  private final Schema schema;
  private final SensitiveFieldMarker markers;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Duration lockTimeout;
  private final SchemaValidator validator = new SchemaValidator();
  private final SecretVault vault;

  private VersionHistory(Builder builder) {
    this.store = builder.store;
    this.codec = builder.codec;
    this.schema = builder.schema;
    this.markers = builder.markers;
    this.clock = builder.clock;
    this.metrics = builder.metrics;
    this.lockTimeout = builder.lockTimeout;
    this.vault = new SecretVault(metrics);
  }

  /**
   * Starts a builder.
   *
   * @param store backing store
   * @param codec record codec
   * @return builder with a permissive schema, default markers, system clock and no metrics
   */
  public static Builder builder(HistoryStorePort store, SnapshotCodec codec) {
    return new Builder(store, codec);
  }

  /**
   * Validates and appends the merged tree as a new snapshot.
   *
   * @param result merge outcome whose tree is committed; sensitive fields must already be encrypted
   * @param author optional author tag, may be {@code null}
   * @return the new snapshot
   * @throws CommitRejectedException when validation fails or a sensitive field is in plaintext
   * @throws ca.gc.cra.smartconfig.domain.error.LockTimeoutException when the store lock is not acquired in time
   * @throws IOException when the store cannot be read or written
   */
  public VersionSnapshot commit(MergeResult result, String author) throws IOException {
    Objects.requireNonNull(result, "result");
    MappingValue tree = result.tree();
    long started = clock.nowMillis();
    try (HistoryStorePort.StoreLock ignored = store.lock(lockTimeout)) {
      ValidationResult validation = validator.validate(tree, schema);
      if (!validation.ok()) {
        metrics.increment("config.commit.rejected");
        log.warn("Commit rejected: {} validation error(s)", validation.errors().size());
        throw new CommitRejectedException(validation.errors());
      }
      List<FieldPath> plaintext = vault.plaintextSecrets(tree, markers);
      if (!plaintext.isEmpty()) {
        metrics.increment("config.commit.rejected");
        log.warn("Commit rejected: {} sensitive field(s) not encrypted", plaintext.size());
        throw new CommitRejectedException("sensitive fields must be encrypted before commit: " + plaintext);
      }

      Chain chain = readChain();
      if (chain.corruption() != null) {
        Path preserved = store.preserveCorruptLog();
        log.warn("Repairing history at {}: {}; damaged log preserved at {}",
            store.location(), chain.corruption().getMessage(), preserved);
      }
      long sequence = chain.lastSequence() + 1;
      VersionSnapshot snapshot =
          new VersionSnapshot(sequence, CanonicalForm.hash(tree), clock.now(), tree, author);
      List<String> records = new ArrayList<>(chain.records());
      records.add(codec.encode(snapshot));
      store.writeRecords(records);

      metrics.increment("config.commit.success");
      metrics.observe("config.commit.duration.ms", clock.nowMillis() - started);
      if (result.hasConflicts()) {
        log.info("Committed {} to {} ({} merge conflict(s) resolved)",
            snapshot.summary(), store.location(), result.conflicts().size());
      } else {
        log.info("Committed {} to {}", snapshot.summary(), store.location());
      }
      return snapshot;
    }
  }

  /**
   * Lazily lists snapshots, newest first. Each iteration re-reads the store, so the sequence is restartable
   * and reflects commits made since the previous iteration.
   *
   * @return finite iterable of snapshots
   * @throws HistoryCorruptionException during iteration, when a damaged record is reached
   * @throws UncheckedIOException during iteration, when the store cannot be read
   */
  public Iterable<VersionSnapshot> history() {
    return () -> {
      try {
        return new NewestFirst(store.readRecords());
      } catch (IOException ex) {
        throw new UncheckedIOException("Failed to read history from " + store.location(), ex);
      }
    };
  }

  /**
   * Returns the newest snapshot.
   *
   * @return newest snapshot, or empty for an empty history
   */
  public Optional<VersionSnapshot> latest() {
    Iterator<VersionSnapshot> it = history().iterator();
    return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
  }

  /**
   * Returns the newest snapshot of the intact part of the log, which is the one the next commit follows.
   * Damaged trailing records are skipped instead of reported.
   *
   * @return newest intact snapshot, or empty when no record is intact
   * @throws IOException when the store cannot be read
   */
  public Optional<VersionSnapshot> latestIntact() throws IOException {
    List<VersionSnapshot> snapshots = readChain().snapshots();
    return snapshots.isEmpty() ? Optional.empty() : Optional.of(snapshots.get(snapshots.size() - 1));
  }

  /**
   * Loads one snapshot.
   *
   * @param sequence sequence number
   * @return snapshot
   * @throws SnapshotNotFoundException when no snapshot has that number
   * @throws HistoryCorruptionException when the log is damaged
   * @throws IOException when the store cannot be read
   */
  public VersionSnapshot snapshot(long sequence) throws IOException {
    for (VersionSnapshot snapshot : readIntact()) {
      if (snapshot.sequence() == sequence) {
        return snapshot;
      }
    }
    throw new SnapshotNotFoundException(sequence);
  }

  /**
   * Compares two snapshots field by field.
   *
   * @param fromSequence older snapshot
   * @param toSequence newer snapshot
   * @return every differing field exactly once; sensitive fields redacted
   * @throws IOException when the store cannot be read
   */
  public List<FieldDelta> diff(long fromSequence, long toSequence) throws IOException {
    List<VersionSnapshot> snapshots = readIntact();
    MappingValue from = find(snapshots, fromSequence).tree();
    MappingValue to = find(snapshots, toSequence).tree();
    return TreeDiff.between(from, to, markers);
  }

  /**
   * Returns the exact tree of a snapshot without committing anything.
   *
   * @param sequence snapshot to restore
   * @return committed tree (sensitive fields still encrypted)
   * @throws IOException when the store cannot be read
   */
  public MappingValue rollback(long sequence) throws IOException {
    MappingValue tree = snapshot(sequence).tree();
    log.info("Rolled back view to snapshot #{} (not committed)", sequence);
    return tree;
  }

  /**
   * Removes all but the newest {@code keepLatest} snapshots. Sequence numbers of the survivors are kept.
   *
   * @param keepLatest number of snapshots to retain, at least 1
   * @return number of snapshots removed
   * @throws IOException when the store cannot be read or written
   */
  public int prune(int keepLatest) throws IOException {
    if (keepLatest < 1) {
      throw new IllegalArgumentException("keepLatest must be >= 1");
    }
    try (HistoryStorePort.StoreLock ignored = store.lock(lockTimeout)) {
      Chain chain = readChain();
      if (chain.corruption() != null) {
        throw chain.corruption();
      }
      int removed = Math.max(0, chain.records().size() - keepLatest);
      if (removed == 0) {
        log.info("Prune kept all {} snapshot(s) in {}", chain.records().size(), store.location());
        return 0;
      }
      store.writeRecords(chain.records().subList(removed, chain.records().size()));
      log.warn("Pruned {} snapshot(s) from {}; kept newest {}", removed, store.location(), keepLatest);
      return removed;
    }
  }

  private List<VersionSnapshot> readIntact() throws IOException {
    Chain chain = readChain();
    if (chain.corruption() != null) {
      throw chain.corruption();
    }
    return chain.snapshots();
  }

  private static VersionSnapshot find(List<VersionSnapshot> snapshots, long sequence) {
    for (VersionSnapshot snapshot : snapshots) {
      if (snapshot.sequence() == sequence) {
        return snapshot;
      }
    }
    throw new SnapshotNotFoundException(sequence);
  }

  /** Reads the log oldest-first and stops at the first damaged record. */
  private Chain readChain() throws IOException {
    List<String> raw = store.readRecords();
    List<String> records = new ArrayList<>();
    List<VersionSnapshot> snapshots = new ArrayList<>();
    long last = 0;
    for (int i = 0; i < raw.size(); i++) {
      VersionSnapshot snapshot;
      try {
        snapshot = verify(raw.get(i), i);
      } catch (HistoryCorruptionException ex) {
        return new Chain(records, snapshots, last, ex);
      }
      if (i > 0 && snapshot.sequence() != last + 1) {
        return new Chain(records, snapshots, last, new HistoryCorruptionException(
            i, "expected sequence #" + (last + 1) + " but found #" + snapshot.sequence()));
      }
      records.add(raw.get(i));
      snapshots.add(snapshot);
      last = snapshot.sequence();
    }
    return new Chain(records, snapshots, last, null);
  }

  private VersionSnapshot verify(String record, int index) {
    VersionSnapshot snapshot;
    try {
      snapshot = codec.decode(record);
    } catch (IllegalArgumentException ex) {
      throw new HistoryCorruptionException(index, "unreadable record", ex);
    }
    if (!CanonicalForm.hash(snapshot.tree()).equals(snapshot.contentHash())) {
      throw new HistoryCorruptionException(index, "content hash mismatch for #" + snapshot.sequence());
    }
    return snapshot;
  }

  private record Chain(
      List<String> records, List<VersionSnapshot> snapshots, long lastSequence,
      HistoryCorruptionException corruption) {}

  /** Walks the raw records backwards, decoding and checking each one only when it is reached. */
  private final class NewestFirst implements Iterator<VersionSnapshot> {
    private final List<String> records;
    private int index;
    private long expected = -1;

    private NewestFirst(List<String> records) {
      this.records = records;
      this.index = records.size() - 1;
    }

    @Override
    public boolean hasNext() {
      return index >= 0;
    }

    @Override
    public VersionSnapshot next() {
      if (index < 0) {
        throw new NoSuchElementException();
      }
      int current = index--;
      VersionSnapshot snapshot = verify(records.get(current), current);
      if (expected != -1 && snapshot.sequence() != expected) {
        index = -1;
        throw new HistoryCorruptionException(
            current, "expected sequence #" + expected + " but found #" + snapshot.sequence());
      }
      expected = snapshot.sequence() - 1;
      return snapshot;
    }
  }

  /** Builder for {@link VersionHistory}. */
  public static final class Builder {
    private final HistoryStorePort store;
    private final SnapshotCodec codec;
    private Schema schema = Schema.permissive();
    private SensitiveFieldMarker markers = SensitiveFieldMarker.defaults();
    private ClockPort clock = ClockPort.SYSTEM;
    private MetricsPort metrics = MetricsPort.NO_OP;
    private Duration lockTimeout = DEFAULT_LOCK_TIMEOUT;

    private Builder(HistoryStorePort store, SnapshotCodec codec) {
      this.store = Objects.requireNonNull(store, "store");
      this.codec = Objects.requireNonNull(codec, "codec");
    }

    public Builder schema(Schema schema) {
      this.schema = Objects.requireNonNull(schema, "schema");
      return this;
    }

    public Builder markers(SensitiveFieldMarker markers) {
      this.markers = Objects.requireNonNull(markers, "markers");
      return this;
    }

    public Builder clock(ClockPort clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder metrics(MetricsPort metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public Builder lockTimeout(Duration lockTimeout) {
      if (lockTimeout == null || lockTimeout.isNegative()) {
        throw new IllegalArgumentException("lockTimeout must be >= 0");
      }
      this.lockTimeout = lockTimeout;
      return this;
    }

    public VersionHistory build() {
      return new VersionHistory(this);
    }
  }
}
