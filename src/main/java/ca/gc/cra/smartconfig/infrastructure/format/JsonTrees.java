package ca.gc.cra.smartconfig.infrastructure.format;

import ca.gc.cra.smartconfig.domain.tree.BooleanValue;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.NullValue;
import ca.gc.cra.smartconfig.domain.tree.NumberValue;
import ca.gc.cra.smartconfig.domain.tree.SequenceValue;
import ca.gc.cra.smartconfig.domain.tree.StringValue;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Streaming conversion between Jackson tokens and configuration trees, shared by the JSON document adapter and
 * the history record codec.
 *
 * @since 0.1.0
 */
public final class JsonTrees {
  private JsonTrees() {}

  /**
   * Reads the value starting at {@code token}.
   *
   * @param parser positioned parser
   * @param token current token
   * @return converted value
   * @throws IOException when the input is malformed
   */
  public static ConfigValue read(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new JsonParseException(parser, "Unexpected end of input");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> StringValue.of(parser.getText());
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> new NumberValue(parser.getDecimalValue());
      case VALUE_TRUE -> BooleanValue.TRUE;
      case VALUE_FALSE -> BooleanValue.FALSE;
      case VALUE_NULL -> NullValue.INSTANCE;
      default -> throw new JsonParseException(parser, "Unexpected JSON token: " + token);
    };
  }

  /**
   * Writes a value as JSON. Numbers use their canonical plain notation.
   *
   * @param generator target generator
   * @param value value to write
   * @throws IOException when writing fails
   */
  public static void write(JsonGenerator generator, ConfigValue value) throws IOException {
    if (value instanceof MappingValue mapping) {
      generator.writeStartObject();
      for (Map.Entry<String, ConfigValue> entry : mapping.entries().entrySet()) {
        generator.writeFieldName(entry.getKey());
        write(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else if (value instanceof SequenceValue sequence) {
      generator.writeStartArray();
      for (ConfigValue item : sequence.items()) {
        write(generator, item);
      }
      generator.writeEndArray();
    } else if (value instanceof StringValue text) {
      generator.writeString(text.value());
    } else if (value instanceof NumberValue number) {
      generator.writeNumber(number.canonicalText());
    } else if (value instanceof BooleanValue bool) {
      generator.writeBoolean(bool.value());
    } else {
      generator.writeNull();
    }
  }

  private static MappingValue readObject(JsonParser parser) throws IOException {
    Map<String, ConfigValue> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new JsonParseException(parser, "Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, read(parser, parser.nextToken()));
    }
    return new MappingValue(map);
  }

  private static SequenceValue readArray(JsonParser parser) throws IOException {
    List<ConfigValue> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      if (token == null) {
        throw new JsonParseException(parser, "Unexpected end of input in array");
      }
      list.add(read(parser, token));
    }
    return new SequenceValue(list);
  }
}
