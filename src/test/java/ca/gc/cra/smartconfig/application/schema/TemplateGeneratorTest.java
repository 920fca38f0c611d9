package ca.gc.cra.smartconfig.application.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.smartconfig.domain.schema.Schema;
import ca.gc.cra.smartconfig.domain.tree.ConfigValues;
import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.NumberValue;
import ca.gc.cra.smartconfig.domain.tree.StringValue;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateGeneratorTest {
  private final TemplateGenerator generator = new TemplateGenerator();

  private Schema schema() {
    return new SchemaParser().parse(ConfigValues.mapping(Map.of("fields", Map.of(
        "db.host", Map.of("type", "string", "required", true),
        "db.port", Map.of("type", "number", "default", 5432),
        "log.level", Map.of("type", "string", "allowed", List.of("info", "debug")),
        "workers", Map.of("type", "number", "min", 2)))));
  }

  @Test
  void fullTemplateUsesDefaultsAndPlaceholders() {
    MappingValue template = generator.generate(schema(), false);

    assertEquals(StringValue.of(""), template.lookup(FieldPath.parse("db.host")).orElseThrow());
    assertEquals(NumberValue.of(5432), template.lookup(FieldPath.parse("db.port")).orElseThrow());
    assertEquals(StringValue.of("info"), template.lookup(FieldPath.parse("log.level")).orElseThrow());
    assertEquals(NumberValue.of(2), template.get("workers"));
  }

  @Test
  void requiredOnlyKeepsRequiredAndDefaultedFields() {
    MappingValue template = generator.generate(schema(), true);

    assertTrue(template.lookup(FieldPath.parse("db.host")).isPresent());
    assertTrue(template.lookup(FieldPath.parse("db.port")).isPresent());
    assertFalse(template.containsKey("log"));
    assertFalse(template.containsKey("workers"));
  }

  @Test
  void templateValidatesAgainstItsSchema() {
    Schema schema = schema();

    assertTrue(new SchemaValidator().validate(generator.generate(schema, false), schema).ok());
  }
}
