package ca.gc.cra.smartconfig.infrastructure.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.smartconfig.domain.error.ConfigSyntaxException;
import ca.gc.cra.smartconfig.domain.error.RootTypeException;
import ca.gc.cra.smartconfig.domain.tree.BooleanValue;
import ca.gc.cra.smartconfig.domain.tree.FieldPath;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.NullValue;
import ca.gc.cra.smartconfig.domain.tree.NumberValue;
import ca.gc.cra.smartconfig.domain.tree.StringValue;
import org.junit.jupiter.api.Test;

class YamlFormatAdapterTest {
  private final YamlFormatAdapter adapter = new YamlFormatAdapter();

  @Test
  void readsYamlScalarsAsTypedValues() {
    String text = String.join("\n",
        "db:",
        "  host: localhost",
        "  port: 5432",
        "  ssl: yes",
        "  legacy: off",
        "  timeout: 1.5",
        "  owner: ~",
        "release: 2024-01-01",
        "mask: 0x1F",
        "");

    MappingValue root = adapter.parse(text, "app.yaml").root();

    assertEquals(StringValue.of("localhost"), root.lookup(FieldPath.parse("db.host")).orElseThrow());
    assertEquals(NumberValue.of(5432), root.lookup(FieldPath.parse("db.port")).orElseThrow());
    assertEquals(BooleanValue.TRUE, root.lookup(FieldPath.parse("db.ssl")).orElseThrow());
    assertEquals(BooleanValue.FALSE, root.lookup(FieldPath.parse("db.legacy")).orElseThrow());
    assertEquals(NumberValue.parse("1.5"), root.lookup(FieldPath.parse("db.timeout")).orElseThrow());
    assertEquals(NullValue.INSTANCE, root.lookup(FieldPath.parse("db.owner")).orElseThrow());
    assertEquals(StringValue.of("2024-01-01"), root.get("release"));
    assertEquals(NumberValue.of(31), root.get("mask"));
  }

  @Test
  void mergeKeysFillMissingEntries() {
    String text = String.join("\n",
        "defaults: &defaults",
        "  host: localhost",
        "  port: 5432",
        "prod:",
        "  <<: *defaults",
        "  host: db.prod",
        "");

    MappingValue prod = (MappingValue) adapter.parse(text, "anchors.yaml").root().get("prod");

    assertEquals(StringValue.of("db.prod"), prod.get("host"));
    assertEquals(NumberValue.of(5432), prod.get("port"));
  }

  @Test
  void duplicateKeyReportsLine() {
    ConfigSyntaxException ex = assertThrows(ConfigSyntaxException.class,
        () -> adapter.parse("a: 1\nb: 2\na: 3\n", "dup.yaml"));

    assertEquals(3, ex.line());
    assertTrue(ex.getMessage().contains("duplicate key 'a'"));
  }

  @Test
  void malformedDocumentIsSyntaxError() {
    ConfigSyntaxException ex = assertThrows(ConfigSyntaxException.class,
        () -> adapter.parse("a: [1, 2\nb: 3\n", "broken.yaml"));

    assertTrue(ex.line() > 0);
  }

  @Test
  void scalarRootIsRejected() {
    assertThrows(RootTypeException.class, () -> adapter.parse("just text\n", "scalar.yaml"));
  }

  @Test
  void emptyDocumentIsEmptyMapping() {
    assertEquals(MappingValue.EMPTY, adapter.parse("", "empty.yaml").root());
  }

  @Test
  void dateLikeStringsSurviveRoundTrip() {
    MappingValue root = MappingValue.builder()
        .put("release", "2024-01-01")
        .put("flag", "yes")
        .put("count", 3)
        .build();

    String text = adapter.serialize(root);

    assertEquals(root, adapter.parse(text, "out.yaml").root());
  }
}
