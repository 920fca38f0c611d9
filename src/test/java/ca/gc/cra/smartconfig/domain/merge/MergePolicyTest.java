package ca.gc.cra.smartconfig.domain.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class MergePolicyTest {

  @Test
  void parsesCaseInsensitively() {
    assertEquals(MergePolicy.ScalarPrecedence.LOWEST_WINS, MergePolicy.ScalarPrecedence.parse("lowest_wins"));
    assertEquals(MergePolicy.SequenceStrategy.APPEND, MergePolicy.SequenceStrategy.parse(" append "));
  }

  @Test
  void rejectsUnknownNames() {
    assertThrows(IllegalArgumentException.class, () -> MergePolicy.ScalarPrecedence.parse("middle"));
    assertThrows(IllegalArgumentException.class, () -> MergePolicy.SequenceStrategy.parse(""));
  }

  @Test
  void defaultIsHighestWinsReplace() {
    assertEquals(MergePolicy.ScalarPrecedence.HIGHEST_WINS, MergePolicy.DEFAULT.scalarPrecedence());
    assertEquals(MergePolicy.SequenceStrategy.REPLACE, MergePolicy.DEFAULT.sequenceStrategy());
  }
}
