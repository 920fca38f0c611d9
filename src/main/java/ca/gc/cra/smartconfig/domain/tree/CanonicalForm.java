package ca.gc.cra.smartconfig.domain.tree;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Reproducible SHA-256 content hash of a configuration tree.
 *
 * <p>Mapping entries are hashed in key order so the digest does not depend on insertion order; sequence
 * elements are hashed in position order. Numbers are hashed by their canonical text, so {@code 1.0} and
 * {@code 1} hash alike, matching {@link NumberValue#equals(Object)}.</p>
 *
 * @since 0.1.0
 */
public final class CanonicalForm {
  private static final byte TAG_NULL = 'n';
  private static final byte TAG_BOOLEAN = 'b';
  private static final byte TAG_NUMBER = 'd';
  private static final byte TAG_STRING = 's';
  private static final byte TAG_SEQUENCE = 'l';
  private static final byte TAG_MAPPING = 'm';

  private CanonicalForm() {}

  /**
   * Computes the lower-case hex SHA-256 digest of {@code value}.
   *
   * @param value tree to hash
   * @return 64 character hex digest
   */
  public static String hash(ConfigValue value) {
    MessageDigest digest = newDigest();
    update(digest, value);
    return HexFormat.of().formatHex(digest.digest());
  }

  private static void update(MessageDigest digest, ConfigValue value) {
    switch (value.kind()) {
      case NULL -> digest.update(TAG_NULL);
      case BOOLEAN -> {
        digest.update(TAG_BOOLEAN);
        digest.update((byte) (((BooleanValue) value).value() ? 1 : 0));
      }
      case NUMBER -> {
        digest.update(TAG_NUMBER);
        text(digest, ((NumberValue) value).canonicalText());
      }
      case STRING -> {
        digest.update(TAG_STRING);
        text(digest, ((StringValue) value).value());
      }
      case SEQUENCE -> {
        SequenceValue sequence = (SequenceValue) value;
        digest.update(TAG_SEQUENCE);
        length(digest, sequence.size());
        for (ConfigValue item : sequence.items()) {
          update(digest, item);
        }
      }
      case MAPPING -> {
        MappingValue mapping = (MappingValue) value;
        List<Map.Entry<String, ConfigValue>> sorted = new ArrayList<>(mapping.entries().entrySet());
        sorted.sort(Map.Entry.comparingByKey());
        digest.update(TAG_MAPPING);
        length(digest, sorted.size());
        for (Map.Entry<String, ConfigValue> entry : sorted) {
          text(digest, entry.getKey());
          update(digest, entry.getValue());
        }
      }
      default -> throw new IllegalStateException("Unhandled kind " + value.kind());
    }
  }

  private static void text(MessageDigest digest, String text) {
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    length(digest, bytes.length);
    digest.update(bytes);
  }

  private static void length(MessageDigest digest, int length) {
    digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(length).array());
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
