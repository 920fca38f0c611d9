package ca.gc.cra.smartconfig.infrastructure.persistence;

import ca.gc.cra.smartconfig.application.port.SnapshotCodec;
import ca.gc.cra.smartconfig.domain.history.VersionSnapshot;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.infrastructure.format.JsonTrees;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * One-line JSON encoding of a snapshot: {@code {"seq":3,"hash":"…","timestamp":"…","author":"…","tree":{…}}}.
 *
 * @since 0.1.0
 */
public final class JsonSnapshotCodec implements SnapshotCodec {
  private final JsonFactory factory =
      new JsonFactoryBuilder().enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION).build();

  @Override
  public String encode(VersionSnapshot snapshot) {
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.writeStartObject();
      generator.writeNumberField("seq", snapshot.sequence());
      generator.writeStringField("hash", snapshot.contentHash());
      generator.writeStringField("timestamp", snapshot.timestamp().toString());
      if (snapshot.author() == null) {
        generator.writeNullField("author");
      } else {
        generator.writeStringField("author", snapshot.author());
      }
      generator.writeFieldName("tree");
      JsonTrees.write(generator, snapshot.tree());
      generator.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode snapshot #" + snapshot.sequence(), ex);
    }
    return out.toString();
  }

  @Override
  public VersionSnapshot decode(String record) {
    Long sequence = null;
    String hash = null;
    Instant timestamp = null;
    String author = null;
    MappingValue tree = null;
    try (JsonParser parser = factory.createParser(record)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("record is not a JSON object");
      }
      JsonToken token;
      while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
        if (token != JsonToken.FIELD_NAME) {
          throw new IllegalArgumentException("malformed record");
        }
        String field = parser.currentName();
        JsonToken valueToken = parser.nextToken();
        switch (field) {
          case "seq" -> {
            if (valueToken != JsonToken.VALUE_NUMBER_INT) {
              throw new IllegalArgumentException("seq must be an integer");
            }
            sequence = parser.getLongValue();
          }
          case "hash" -> hash = requireText(parser, valueToken, field);
          case "timestamp" -> timestamp = Instant.parse(requireText(parser, valueToken, field));
          case "author" -> author = valueToken == JsonToken.VALUE_NULL ? null : requireText(parser, valueToken, field);
          case "tree" -> {
            ConfigValue value = JsonTrees.read(parser, valueToken);
            if (!(value instanceof MappingValue mapping)) {
              throw new IllegalArgumentException("tree must be an object");
            }
            tree = mapping;
          }
          default -> parser.skipChildren();
        }
      }
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("trailing content after record");
      }
    } catch (IOException | DateTimeParseException ex) {
      throw new IllegalArgumentException("unreadable record: " + ex.getMessage(), ex);
    }
    if (sequence == null || hash == null || timestamp == null || tree == null) {
      throw new IllegalArgumentException("record is missing required fields");
    }
    return new VersionSnapshot(sequence, hash, timestamp, tree, author);
  }

  private static String requireText(JsonParser parser, JsonToken token, String field) throws IOException {
    if (token != JsonToken.VALUE_STRING) {
      throw new IllegalArgumentException(field + " must be a string");
    }
    return parser.getText();
  }
}
