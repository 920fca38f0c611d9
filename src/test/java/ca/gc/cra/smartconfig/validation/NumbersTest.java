package ca.gc.cra.smartconfig.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parsesValueInsideRange() {
    assertEquals(250L, Numbers.parseInRange("lockTimeoutMs", " 250 ", 1, 1000));
  }

  @Test
  void rejectsOutOfRangeAndNonNumeric() {
    IllegalArgumentException range = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInRange("lockTimeoutMs", "0", 1, 1000));
    IllegalArgumentException text = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInRange("keep", "ten", 1, 1000));

    assertEquals("lockTimeoutMs must be between 1 and 1000 (was 0)", range.getMessage());
    assertTrue(text.getMessage().startsWith("keep must be an integer"));
  }
}
