package ca.gc.cra.smartconfig.application.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.smartconfig.domain.merge.ConflictKind;
import ca.gc.cra.smartconfig.domain.merge.ConflictRecord;
import ca.gc.cra.smartconfig.domain.merge.MergePolicy;
import ca.gc.cra.smartconfig.domain.merge.MergeResult;
import ca.gc.cra.smartconfig.domain.merge.MergeSource;
import ca.gc.cra.smartconfig.domain.tree.ConfigValues;
import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.NumberValue;
import ca.gc.cra.smartconfig.domain.tree.SequenceValue;
import ca.gc.cra.smartconfig.domain.tree.StringValue;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MergeEngineTest {
  private final MergeEngine engine = new MergeEngine();

  @Test
  void higherPrecedenceScalarWinsAndConflictIsRecorded() {
    MappingValue base = ConfigValues.mapping(Map.of("db", Map.of("host", "localhost", "port", 5432)));
    MappingValue prod = ConfigValues.mapping(Map.of("db", Map.of("host", "db.prod")));

    MergeResult result = engine.merge(List.of(new MergeSource("base.yaml", base), new MergeSource("prod.yaml", prod)));

    assertEquals(StringValue.of("db.prod"), result.tree().lookup(FieldPath.parse("db.host")).orElseThrow());
    assertEquals(NumberValue.of(5432), result.tree().lookup(FieldPath.parse("db.port")).orElseThrow());
    assertEquals(1, result.conflicts().size());
    ConflictRecord conflict = result.conflicts().get(0);
    assertEquals(FieldPath.parse("db.host"), conflict.path());
    assertEquals(ConflictKind.VALUE_CONFLICT, conflict.kind());
    assertEquals(List.of("base.yaml", "prod.yaml"), conflict.sources());
    assertEquals("prod.yaml", conflict.winner());
    assertEquals("db.host: VALUE_CONFLICT between [base.yaml, prod.yaml]; kept prod.yaml", conflict.describe());
  }

  @Test
  void equalValuesDoNotConflict() {
    MappingValue a = ConfigValues.mapping(Map.of("port", 8080));
    MappingValue b = ConfigValues.mapping(Map.of("port", 8080.0));

    assertFalse(engine.mergeTrees(List.of(a, b)).hasConflicts());
  }

  @Test
  void disjointSourcesMergeIndependentlyOfOrder() {
    MappingValue a = ConfigValues.mapping(Map.of("a", 1, "nested", Map.of("x", 1)));
    MappingValue b = ConfigValues.mapping(Map.of("b", 2, "nested", Map.of("y", 2)));

    MergeResult forward = engine.mergeTrees(List.of(a, b));
    MergeResult backward = engine.mergeTrees(List.of(b, a));

    assertEquals(forward.tree(), backward.tree());
    assertFalse(forward.hasConflicts());
    assertEquals(3, forward.tree().size());
  }

  @Test
  void mergeIsDeterministic() {
    MappingValue a = ConfigValues.mapping(Map.of("k", "one", "list", List.of(1, 2)));
    MappingValue b = ConfigValues.mapping(Map.of("k", "two", "list", List.of(3)));

    MergeResult first = engine.mergeTrees(List.of(a, b));
    MergeResult second = engine.mergeTrees(List.of(a, b));

    assertEquals(first, second);
  }

  @Test
  void sequencesReplacedByDefault() {
    MappingValue a = ConfigValues.mapping(Map.of("list", List.of(1, 2)));
    MappingValue b = ConfigValues.mapping(Map.of("list", List.of(3)));

    MergeResult result = engine.mergeTrees(List.of(a, b));

    assertEquals(SequenceValue.of(NumberValue.of(3)), result.tree().get("list"));
    assertEquals(ConflictKind.VALUE_CONFLICT, result.conflicts().get(0).kind());
  }

  @Test
  void appendStrategyConcatenatesSequences() {
    MergeEngine appending = new MergeEngine(
        new MergePolicy(MergePolicy.ScalarPrecedence.HIGHEST_WINS, MergePolicy.SequenceStrategy.APPEND));
    MappingValue a = ConfigValues.mapping(Map.of("list", List.of(1, 2)));
    MappingValue b = ConfigValues.mapping(Map.of("list", List.of(3)));

    MergeResult result = appending.mergeTrees(List.of(a, b));

    assertEquals(SequenceValue.of(NumberValue.of(1), NumberValue.of(2), NumberValue.of(3)), result.tree().get("list"));
    assertFalse(result.hasConflicts());
  }

  @Test
  void lowestWinsKeepsFirstSource() {
    MergeEngine lowest = new MergeEngine(
        new MergePolicy(MergePolicy.ScalarPrecedence.LOWEST_WINS, MergePolicy.SequenceStrategy.REPLACE));
    MappingValue a = ConfigValues.mapping(Map.of("host", "first"));
    MappingValue b = ConfigValues.mapping(Map.of("host", "second"));

    MergeResult result = lowest.mergeTrees(List.of(a, b));

    assertEquals(StringValue.of("first"), result.tree().get("host"));
    assertEquals("source-1", result.conflicts().get(0).winner());
    assertEquals(List.of("source-1", "source-2"), result.conflicts().get(0).sources());
  }

  @Test
  void kindMismatchRecordsTypeConflict() {
    MappingValue a = ConfigValues.mapping(Map.of("db", Map.of("host", "x")));
    MappingValue b = ConfigValues.mapping(Map.of("db", "sqlite://memory"));

    MergeResult result = engine.mergeTrees(List.of(a, b));

    assertEquals(StringValue.of("sqlite://memory"), result.tree().get("db"));
    assertEquals(1, result.conflicts().size());
    assertEquals(ConflictKind.TYPE_CONFLICT, result.conflicts().get(0).kind());
    assertEquals("source-2", result.conflicts().get(0).winner());
  }

  @Test
  void mappingOverScalarOnlyMergesContiguousMappings() {
    MappingValue a = ConfigValues.mapping(Map.of("db", Map.of("user", "old")));
    MappingValue b = ConfigValues.mapping(Map.of("db", "none"));
    MappingValue c = ConfigValues.mapping(Map.of("db", Map.of("host", "h")));

    MergeResult result = engine.mergeTrees(List.of(a, b, c));

    assertEquals(ConfigValues.mapping(Map.of("host", "h")), result.tree().get("db"));
    assertTrue(result.hasConflicts());
  }

  @Test
  void emptySourceListYieldsEmptyTree() {
    MergeResult result = engine.merge(List.of());

    assertEquals(MappingValue.EMPTY, result.tree());
    assertFalse(result.hasConflicts());
  }
}
