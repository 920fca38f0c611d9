package ca.gc.cra.smartconfig.application.port;

import ca.gc.cra.smartconfig.domain.tree.ConfigDocument;
import ca.gc.cra.smartconfig.domain.tree.ConfigFormat;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Reads and writes configuration documents, choosing the format adapter by file
 * extension or explicit format.
 * <p><strong>Why:</strong> Keeps format selection and file I/O out of the use cases.</p>
 *
 * @since 0.1.0
 */
public interface DocumentStorePort {
  /**
   * Loads a document; the format is detected from the file extension.
   *
   * @param file source file
   * @return parsed document whose origin is the file path
   * @throws IOException when the file cannot be read
   * @throws ca.gc.cra.smartconfig.domain.error.UnsupportedFormatException for unknown extensions
   * @throws ca.gc.cra.smartconfig.domain.error.ConfigParseException for malformed content
   */
  ConfigDocument load(Path file) throws IOException;

  /**
   * Parses in-memory text.
   *
   * @param text raw document text
   * @param format source format
   * @param origin label used in error messages
   * @return parsed document
   */
  ConfigDocument parse(String text, ConfigFormat format, String origin);

  /**
   * Serializes a tree.
   *
   * @param value tree to render
   * @param format target format
   * @return document text
   * @throws ca.gc.cra.smartconfig.domain.error.SerializationException when the format cannot express the tree
   */
  String render(ConfigValue value, ConfigFormat format);

  /**
   * Serializes a tree and replaces {@code file} atomically.
   *
   * @param value tree to write
   * @param file target file
   * @param format target format, or {@code null} to detect from the extension
   * @throws IOException when the file cannot be written
   */
  void save(ConfigValue value, Path file, ConfigFormat format) throws IOException;
}
