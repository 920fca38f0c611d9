package ca.gc.cra.smartconfig.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("short", Logs.truncate("short", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
  }

  @Test
  void truncateCutsOnCharacterBoundary() {
    String truncated = Logs.truncate("ééééé", 3);

    assertTrue(truncated.startsWith("é... (truncated, 3 of 10 bytes)"));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void redactHidesEverything() {
    assertEquals("[REDACTED]", Logs.redact("hunter2"));
    assertEquals("[REDACTED]", Logs.redact(null));
  }
}
