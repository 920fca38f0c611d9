package ca.gc.cra.smartconfig.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.smartconfig.domain.history.VersionSnapshot;
import ca.gc.cra.smartconfig.domain.tree.CanonicalForm;
import ca.gc.cra.smartconfig.domain.tree.ConfigValues;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSnapshotCodecTest {
  private final JsonSnapshotCodec codec = new JsonSnapshotCodec();

  private static VersionSnapshot snapshot(String author) {
    MappingValue tree = ConfigValues.mapping(Map.of("db", Map.of("host", "h\nx", "ports", List.of(1, 2))));
    return new VersionSnapshot(3, CanonicalForm.hash(tree), Instant.parse("2024-05-01T10:00:00Z"), tree, author);
  }

  @Test
  void encodesOnOneLine() {
    String record = codec.encode(snapshot("alice"));

    assertFalse(record.contains("\n"));
    assertTrue(record.startsWith("{\"seq\":3,"));
    assertEquals(snapshot("alice"), codec.decode(record));
  }

  @Test
  void nullAuthorSurvives() {
    assertNull(codec.decode(codec.encode(snapshot(null))).author());
  }

  @Test
  void rejectsDamagedRecords() {
    assertThrows(IllegalArgumentException.class, () -> codec.decode("{\"seq\":1"));
    assertThrows(IllegalArgumentException.class, () -> codec.decode("[]"));
    assertThrows(IllegalArgumentException.class, () -> codec.decode("{\"seq\":1,\"hash\":\"x\"}"));
    assertThrows(IllegalArgumentException.class,
        () -> codec.decode("{\"seq\":\"1\",\"hash\":\"x\",\"timestamp\":\"2024-05-01T10:00:00Z\",\"tree\":{}}"));
    assertThrows(IllegalArgumentException.class,
        () -> codec.decode("{\"seq\":1,\"hash\":\"x\",\"timestamp\":\"yesterday\",\"tree\":{}}"));
  }
}
