package ca.gc.cra.smartconfig.domain.history;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.smartconfig.domain.tree.ConfigValues;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class VersionSnapshotTest {
  private static final MappingValue TREE = ConfigValues.mapping(Map.of("a", 1));
  private static final String HASH = "0123456789abcdef0123456789abcdef";

  @Test
  void summaryShortensHashAndOmitsTree() {
    VersionSnapshot snapshot =
        new VersionSnapshot(3, HASH, Instant.parse("2024-05-01T10:00:00Z"), TREE, "alice");

    assertEquals("#3 2024-05-01T10:00:00Z 0123456789ab alice", snapshot.summary());
  }

  @Test
  void authorIsOptional() {
    VersionSnapshot snapshot = new VersionSnapshot(1, HASH, Instant.EPOCH, TREE, null);

    assertTrue(snapshot.authorTag().isEmpty());
    assertEquals("#1 1970-01-01T00:00:00Z 0123456789ab", snapshot.summary());
  }

  @Test
  void sequenceStartsAtOne() {
    assertThrows(IllegalArgumentException.class, () -> new VersionSnapshot(0, HASH, Instant.EPOCH, TREE, null));
  }
}
