package ca.gc.cra.smartconfig.application.history;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.smartconfig.application.port.FixedClock;
import ca.gc.cra.smartconfig.application.port.HistoryStorePort;
import ca.gc.cra.smartconfig.application.port.RecordingMetricsPort;
import ca.gc.cra.smartconfig.application.secret.SecretVault;
import ca.gc.cra.smartconfig.application.secret.VaultKey;
import ca.gc.cra.smartconfig.domain.error.CommitRejectedException;
import ca.gc.cra.smartconfig.domain.error.HistoryCorruptionException;
import ca.gc.cra.smartconfig.domain.error.LockTimeoutException;
import ca.gc.cra.smartconfig.domain.error.SnapshotNotFoundException;
import ca.gc.cra.smartconfig.domain.history.FieldDelta;
import ca.gc.cra.smartconfig.domain.history.VersionSnapshot;
import ca.gc.cra.smartconfig.domain.merge.MergeResult;
import ca.gc.cra.smartconfig.domain.schema.FieldErrorKind;
import ca.gc.cra.smartconfig.domain.schema.FieldRule;
import ca.gc.cra.smartconfig.domain.schema.Schema;
import ca.gc.cra.smartconfig.domain.secret.SensitiveFieldMarker;
import ca.gc.cra.smartconfig.domain.tree.ConfigValues;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.ValueKind;
import ca.gc.cra.smartconfig.infrastructure.persistence.FileHistoryStore;
import ca.gc.cra.smartconfig.infrastructure.persistence.JsonSnapshotCodec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VersionHistoryTest {
  @TempDir Path tempDir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  private VersionHistory history(Schema schema) {
    return VersionHistory.builder(new FileHistoryStore(tempDir), new JsonSnapshotCodec())
        .schema(schema)
        .clock(new FixedClock(1_700_000_000_000L))
        .metrics(metrics)
        .lockTimeout(Duration.ofMillis(200))
        .build();
  }

  private VersionHistory history() {
    return history(Schema.permissive());
  }

  private static MergeResult tree(String host, int port) {
    return MergeResult.of(ConfigValues.mapping(Map.of("db", Map.of("host", host, "port", port))));
  }

  private List<String> logLines() throws IOException {
    return Files.readAllLines(tempDir.resolve(FileHistoryStore.LOG_FILE), StandardCharsets.UTF_8);
  }

  @Test
  void commitsReceiveConsecutiveSequenceNumbers() throws IOException {
    VersionHistory history = history();

    VersionSnapshot first = history.commit(tree("a", 1), "alice");
    VersionSnapshot second = history.commit(tree("b", 1), null);

    assertEquals(1, first.sequence());
    assertEquals(2, second.sequence());
    assertEquals("alice", first.authorTag().orElseThrow());
    assertTrue(second.authorTag().isEmpty());
    assertEquals(2, logLines().size());
    assertEquals(2, metrics.count("config.commit.success"));
    assertEquals(2, metrics.observed("config.commit.duration.ms").size());
  }

  @Test
  void rollbackReturnsCommittedTreeExactly() throws IOException {
    VersionHistory history = history();
    MergeResult committed = tree("a", 1);

    long sequence = history.commit(committed, "alice").sequence();
    history.commit(tree("b", 2), "bob");

    assertEquals(committed.tree(), history.rollback(sequence));
    assertEquals(2, logLines().size());
  }

  @Test
  void historyListsNewestFirstAndIsRestartable() throws IOException {
    VersionHistory history = history();
    history.commit(tree("a", 1), null);
    history.commit(tree("b", 1), null);
    history.commit(tree("c", 1), null);

    List<Long> firstPass = new ArrayList<>();
    history.history().forEach(s -> firstPass.add(s.sequence()));
    history.commit(tree("d", 1), null);
    List<Long> secondPass = new ArrayList<>();
    history.history().forEach(s -> secondPass.add(s.sequence()));

    assertEquals(List.of(3L, 2L, 1L), firstPass);
    assertEquals(List.of(4L, 3L, 2L, 1L), secondPass);
    assertEquals(4, history.latest().orElseThrow().sequence());
  }

  @Test
  void emptyHistoryHasNoLatest() {
    assertTrue(history().latest().isEmpty());
    assertFalse(history().history().iterator().hasNext());
  }

  @Test
  void diffBetweenSnapshotsListsChangedFields() throws IOException {
    VersionHistory history = history();
    history.commit(tree("a", 1), null);
    history.commit(tree("b", 1), null);
    history.commit(tree("c", 2), null);

    List<FieldDelta> deltas = history.diff(1, 3);

    assertEquals(2, deltas.size());
    assertEquals("~ db.host: \"a\" -> \"c\"", deltas.get(0).render());
    assertEquals("~ db.port: 1 -> 2", deltas.get(1).render());
    assertTrue(history.diff(2, 2).isEmpty());
  }

  @Test
  void unknownSequenceIsReported() throws IOException {
    VersionHistory history = history();
    history.commit(tree("a", 1), null);

    assertThrows(SnapshotNotFoundException.class, () -> history.rollback(7));
    assertThrows(SnapshotNotFoundException.class, () -> history.diff(1, 9));
  }

  @Test
  void invalidTreeIsRejectedWithoutWriting() throws IOException {
    Schema schema = Schema.of(Map.of(
        "db.port", FieldRule.builder().kind(ValueKind.NUMBER).required(true).build()), false);
    VersionHistory history = history(schema);
    history.commit(tree("a", 1), null);
    MergeResult invalid = MergeResult.of(ConfigValues.mapping(Map.of("db", Map.of("port", "x"))));

    CommitRejectedException ex = assertThrows(CommitRejectedException.class, () -> history.commit(invalid, null));

    assertEquals(1, ex.errors().size());
    assertEquals(FieldErrorKind.TYPE_MISMATCH, ex.errors().get(0).kind());
    assertEquals(1, logLines().size());
    assertEquals(1, metrics.count("config.commit.rejected"));
  }

  @Test
  void plaintextSecretsAreRejected() throws IOException {
    VersionHistory history = history();
    MergeResult plaintext = MergeResult.of(ConfigValues.mapping(Map.of("db", Map.of("password_secret", "pw"))));

    CommitRejectedException ex = assertThrows(CommitRejectedException.class, () -> history.commit(plaintext, null));
    assertTrue(ex.getMessage().contains("db.password_secret"));
    assertFalse(Files.exists(tempDir.resolve(FileHistoryStore.LOG_FILE)));

    VaultKey key = VaultKey.fromBytes(new byte[VaultKey.KEY_BYTES]);
    MappingValue encrypted = new SecretVault().encryptFields(plaintext.tree(), SensitiveFieldMarker.defaults(), key);
    assertEquals(1, history.commit(MergeResult.of(encrypted), null).sequence());
  }

  @Test
  void corruptTailIsPreservedAndRepairedOnNextCommit() throws IOException {
    VersionHistory history = history();
    history.commit(tree("a", 1), null);
    history.commit(tree("b", 1), null);
    Path logFile = tempDir.resolve(FileHistoryStore.LOG_FILE);
    List<String> lines = logLines();
    lines.set(1, lines.get(1).replace("\"b\"", "\"tampered\""));
    Files.write(logFile, lines, StandardCharsets.UTF_8);

    assertThrows(HistoryCorruptionException.class, () -> history.diff(1, 2));
    VersionSnapshot repaired = history.commit(tree("c", 1), null);

    assertEquals(2, repaired.sequence());
    assertEquals(2, logLines().size());
    try (Stream<Path> files = Files.list(tempDir)) {
      assertTrue(files.anyMatch(p -> p.getFileName().toString().startsWith(FileHistoryStore.LOG_FILE + ".corrupt-")));
    }
    assertEquals(tree("a", 1).tree(), history.rollback(1));
  }

  @Test
  void iterationStopsAtDamagedRecord() throws IOException {
    VersionHistory history = history();
    history.commit(tree("a", 1), null);
    history.commit(tree("b", 1), null);
    List<String> lines = logLines();
    lines.set(0, "{not json");
    Files.write(tempDir.resolve(FileHistoryStore.LOG_FILE), lines, StandardCharsets.UTF_8);

    Iterator<VersionSnapshot> iterator = history.history().iterator();

    assertEquals(2, iterator.next().sequence());
    assertThrows(HistoryCorruptionException.class, iterator::next);
  }

  @Test
  void commitTimesOutWhileAnotherWriterHoldsTheLock() throws IOException {
    VersionHistory history = history();
    FileHistoryStore other = new FileHistoryStore(tempDir);

    try (HistoryStorePort.StoreLock held = other.lock(Duration.ofSeconds(1))) {
      LockTimeoutException ex = assertThrows(LockTimeoutException.class, () -> history.commit(tree("a", 1), null));
      assertEquals(Duration.ofMillis(200), ex.timeout());
    }
    assertEquals(1, history.commit(tree("a", 1), null).sequence());
  }

  @Test
  void pruneKeepsNewestSnapshotsAndTheirNumbers() throws IOException {
    VersionHistory history = history();
    for (int i = 1; i <= 5; i++) {
      history.commit(tree("h" + i, i), null);
    }

    assertEquals(3, history.prune(2));
    assertEquals(0, history.prune(2));

    List<Long> remaining = new ArrayList<>();
    history.history().forEach(s -> remaining.add(s.sequence()));
    assertEquals(List.of(5L, 4L), remaining);
    assertEquals(6, history.commit(tree("h6", 6), null).sequence());
    assertThrows(IllegalArgumentException.class, () -> history.prune(0));
  }

  @Test
  void unchangedTreeStillCreatesSnapshotWithSameHash() throws IOException {
    VersionHistory history = history();

    VersionSnapshot first = history.commit(tree("a", 1), null);
    VersionSnapshot second = history.commit(tree("a", 1), null);

    assertEquals(first.contentHash(), second.contentHash());
    assertEquals(2, second.sequence());
  }
}
