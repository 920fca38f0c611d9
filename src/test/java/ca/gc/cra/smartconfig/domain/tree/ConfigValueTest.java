package ca.gc.cra.smartconfig.domain.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigValueTest {

  @Test
  void numbersCompareByValueNotScale() {
    assertEquals(NumberValue.of(5), NumberValue.parse("5.0"));
    assertEquals(NumberValue.of(5).hashCode(), NumberValue.parse("5.00").hashCode());
    assertTrue(NumberValue.parse("1e3").isIntegral());
    assertFalse(NumberValue.parse("1.5").isIntegral());
    assertEquals("1000", NumberValue.parse("1e3").canonicalText());
  }

  @Test
  void nonFiniteNumbersRejected() {
    assertThrows(IllegalArgumentException.class, () -> NumberValue.of(Double.NaN));
    assertThrows(IllegalArgumentException.class, () -> NumberValue.of(Double.POSITIVE_INFINITY));
  }

  @Test
  void mappingEqualityIgnoresKeyOrder() {
    MappingValue first = MappingValue.builder().put("a", 1).put("b", "x").build();
    MappingValue second = MappingValue.builder().put("b", "x").put("a", 1).build();

    assertEquals(first, second);
    assertEquals(CanonicalForm.hash(first), CanonicalForm.hash(second));
    assertEquals(List.of("a", "b"), List.copyOf(first.keys()));
  }

  @Test
  void hashDistinguishesKinds() {
    assertNotEquals(
        CanonicalForm.hash(StringValue.of("1")), CanonicalForm.hash(NumberValue.of(1)));
    assertEquals(64, CanonicalForm.hash(NullValue.INSTANCE).length());
  }

  @Test
  void lookupWalksMappingsAndSequences() {
    MappingValue tree = ConfigValues.mapping(Map.of(
        "servers", List.of(Map.of("name", "alpha"), Map.of("name", "beta"))));

    assertEquals(StringValue.of("beta"), tree.lookup(FieldPath.parse("servers[1].name")).orElseThrow());
    assertTrue(tree.lookup(FieldPath.parse("servers[5].name")).isEmpty());
    assertTrue(tree.lookup(FieldPath.parse("servers.name")).isEmpty());
  }

  @Test
  void javaConversionRoundTripsStructure() {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("enabled", true);
    raw.put("ratio", 0.5);
    raw.put("nothing", null);
    raw.put("tags", List.of("a", "b"));

    MappingValue tree = ConfigValues.mapping(raw);
    Object back = ConfigValues.toJava(tree);

    assertEquals(BooleanValue.TRUE, tree.get("enabled"));
    assertEquals(NullValue.INSTANCE, tree.get("nothing"));
    assertEquals(new BigDecimal("0.5"), ((Map<?, ?>) back).get("ratio"));
    assertEquals(List.of("a", "b"), ((Map<?, ?>) back).get("tags"));
  }

  @Test
  void withAndWithoutReturnCopies() {
    MappingValue base = MappingValue.builder().put("a", 1).build();
    MappingValue extended = base.with("b", StringValue.of("x"));

    assertEquals(1, base.size());
    assertEquals(2, extended.size());
    assertEquals(base, extended.without("b"));
  }
}
