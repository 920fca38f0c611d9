package ca.gc.cra.smartconfig.application.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.smartconfig.domain.error.UnresolvedReferenceException;
import ca.gc.cra.smartconfig.domain.tree.ConfigValues;
import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.NumberValue;
import ca.gc.cra.smartconfig.domain.tree.StringValue;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvironmentResolverTest {
  private final EnvironmentResolver resolver = new EnvironmentResolver();
  private final Map<String, String> env = Map.of("DB_HOST", "db.internal", "EMPTY", "");

  @Test
  void substitutesVariablesInNestedStrings() {
    MappingValue tree = ConfigValues.mapping(Map.of(
        "db", Map.of("url", "jdbc://${DB_HOST}:5432/app"),
        "hosts", List.of("${DB_HOST}", "static")));

    MappingValue resolved = resolver.resolveMapping(tree, env::get);

    assertEquals(StringValue.of("jdbc://db.internal:5432/app"),
        resolved.lookup(FieldPath.parse("db.url")).orElseThrow());
    assertEquals(StringValue.of("db.internal"), resolved.lookup(FieldPath.parse("hosts[0]")).orElseThrow());
  }

  @Test
  void fallsBackToDefaultWhenUnsetOrEmpty() {
    MappingValue tree = ConfigValues.mapping(Map.of(
        "port", "${DB_PORT:-5432}",
        "mode", "${EMPTY:-dev}"));

    MappingValue resolved = resolver.resolveMapping(tree, env::get);

    assertEquals(StringValue.of("5432"), resolved.get("port"));
    assertEquals(StringValue.of("dev"), resolved.get("mode"));
  }

  @Test
  void unsetVariableWithoutDefaultNamesPath() {
    MappingValue tree = ConfigValues.mapping(Map.of("db", Map.of("password", "${DB_PASSWORD}")));

    UnresolvedReferenceException ex = assertThrows(
        UnresolvedReferenceException.class, () -> resolver.resolveMapping(tree, env::get));

    assertEquals("db.password", ex.path());
    assertEquals("DB_PASSWORD", ex.variable());
  }

  @Test
  void escapedPlaceholderIsLiteral() {
    MappingValue tree = ConfigValues.mapping(Map.of("template", "$${DB_HOST} is ${DB_HOST}"));

    assertEquals(StringValue.of("${DB_HOST} is db.internal"), resolver.resolveMapping(tree, env::get).get("template"));
  }

  @Test
  void malformedPlaceholdersFail() {
    MappingValue unterminated = ConfigValues.mapping(Map.of("x", "${DB_HOST"));
    MappingValue badName = ConfigValues.mapping(Map.of("x", "${1BAD}"));

    assertThrows(UnresolvedReferenceException.class, () -> resolver.resolveMapping(unterminated, env::get));
    assertThrows(UnresolvedReferenceException.class, () -> resolver.resolveMapping(badName, env::get));
  }

  @Test
  void nonStringValuesPassThrough() {
    NumberValue number = NumberValue.of(7);

    assertSame(number, resolver.resolve(number, env::get));
  }
}
