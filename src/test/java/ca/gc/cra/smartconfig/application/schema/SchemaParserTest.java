package ca.gc.cra.smartconfig.application.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.smartconfig.domain.schema.FieldRule;
import ca.gc.cra.smartconfig.domain.schema.Schema;
import ca.gc.cra.smartconfig.domain.tree.ConfigValues;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.ValueKind;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SchemaParserTest {
  private final SchemaParser parser = new SchemaParser();

  @Test
  void parsesDottedFieldsWithConstraints() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("db.host", Map.of("type", "string", "required", true));
    fields.put("db.port", Map.of("type", "number", "min", 1, "max", 65535));
    fields.put("log.level", Map.of("type", "string", "allowed", List.of("debug", "info")));
    fields.put("feature", "boolean");
    MappingValue document = ConfigValues.mapping(Map.of("strict", true, "fields", fields));

    Schema schema = parser.parse(document);

    assertTrue(schema.strict());
    assertEquals(List.of("db", "log", "feature"), schema.rootFields());
    FieldRule port = schema.root().children().get("db").children().get("port");
    assertEquals(ValueKind.NUMBER, port.kind());
    assertEquals(0, BigDecimal.valueOf(65535).compareTo(port.max()));
    assertTrue(schema.root().children().get("db").children().get("host").required());
    assertEquals(ValueKind.BOOLEAN, schema.root().children().get("feature").kind());
  }

  @Test
  void documentWithoutFieldsKeyIsFieldMap() {
    Schema schema = parser.parse(ConfigValues.mapping(Map.of("name", "string", "anything", "any")));

    assertEquals(ValueKind.STRING, schema.root().children().get("name").kind());
    assertNull(schema.root().children().get("anything").kind());
  }

  @Test
  void nestedItemsAreParsed() {
    MappingValue document = ConfigValues.mapping(Map.of("servers", Map.of(
        "type", "sequence",
        "items", Map.of("type", "mapping", "fields", Map.of("name", Map.of("type", "string", "required", true))))));

    FieldRule servers = parser.parse(document).root().children().get("servers");

    assertEquals(ValueKind.SEQUENCE, servers.kind());
    assertTrue(servers.items().children().get("name").required());
  }

  @Test
  void rejectsInvalidRules() {
    assertThrows(IllegalArgumentException.class,
        () -> parser.parse(ConfigValues.mapping(Map.of("a", Map.of("type", "decimal")))));
    assertThrows(IllegalArgumentException.class,
        () -> parser.parse(ConfigValues.mapping(Map.of("a", Map.of("colour", "red")))));
    assertThrows(IllegalArgumentException.class,
        () -> parser.parse(ConfigValues.mapping(Map.of("a", Map.of("type", "string", "pattern", "[")))));
    assertThrows(IllegalArgumentException.class,
        () -> parser.parse(ConfigValues.mapping(Map.of("a", Map.of("type", "number", "default", "x")))));
    assertThrows(IllegalArgumentException.class,
        () -> parser.parse(ConfigValues.mapping(Map.of("strict", "yes", "fields", Map.of()))));
  }
}
