package ca.gc.cra.smartconfig.infrastructure.format;

import ca.gc.cra.smartconfig.application.port.FormatAdapter;
import ca.gc.cra.smartconfig.domain.error.ConfigSyntaxException;
import ca.gc.cra.smartconfig.domain.error.RootTypeException;
import ca.gc.cra.smartconfig.domain.error.SerializationException;
import ca.gc.cra.smartconfig.domain.tree.ConfigDocument;
import ca.gc.cra.smartconfig.domain.tree.ConfigFormat;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import java.io.IOException;
import java.io.StringWriter;
import java.util.Objects;

/**
 * JSON adapter built on the Jackson streaming API. Lossless: numbers are read as {@link java.math.BigDecimal}
 * and written in canonical plain notation. Duplicate keys and non-finite literals are rejected.
 *
 * @since 0.1.0
 */
public final class JsonFormatAdapter implements FormatAdapter {
  private final JsonFactory factory =
      new JsonFactoryBuilder().enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION).build();

  @Override
  public ConfigFormat format() {
    return ConfigFormat.JSON;
  }

  @Override
  public ConfigDocument parse(String text, String origin) {
    Objects.requireNonNull(text, "text");
    if (text.isBlank()) {
      return new ConfigDocument(MappingValue.EMPTY, ConfigFormat.JSON, origin);
    }
    try (JsonParser parser = factory.createParser(text)) {
      JsonToken token = parser.nextToken();
      ConfigValue value = JsonTrees.read(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null) {
        JsonLocation location = parser.currentLocation();
        throw new ConfigSyntaxException(origin, location.getLineNr(), location.getColumnNr(),
            "trailing content after document", null);
      }
      if (!(value instanceof MappingValue mapping)) {
        throw new RootTypeException(origin, value.kind());
      }
      return new ConfigDocument(mapping, ConfigFormat.JSON, origin);
    } catch (JsonProcessingException ex) {
      JsonLocation location = ex.getLocation();
      int line = location == null ? -1 : location.getLineNr();
      int column = location == null ? -1 : location.getColumnNr();
      throw new ConfigSyntaxException(origin, line, column, ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new ConfigSyntaxException(origin, -1, -1, ex.getMessage(), ex);
    }
  }

  @Override
  public String serialize(ConfigValue value) {
    Objects.requireNonNull(value, "value");
    StringWriter out = new StringWriter();
    DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
        .withObjectIndenter(new DefaultIndenter("  ", "\n"))
        .withArrayIndenter(new DefaultIndenter("  ", "\n"));
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.setPrettyPrinter(printer);
      JsonTrees.write(generator, value);
    } catch (IOException ex) {
      throw new SerializationException(ConfigFormat.JSON, "<root>", ex.getMessage(), ex);
    }
    return out + "\n";
  }
}
