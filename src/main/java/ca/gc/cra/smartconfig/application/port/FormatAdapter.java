package ca.gc.cra.smartconfig.application.port;

import ca.gc.cra.smartconfig.domain.tree.ConfigDocument;
import ca.gc.cra.smartconfig.domain.tree.ConfigFormat;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;

/**
 * <strong>What:</strong> Converts between serialized text in one format and the canonical tree.
 * <p><strong>Why:</strong> Isolates every format quirk (missing null, missing sequences, date literals) so the
 * rest of the core stays format-agnostic.</p>
 * <p><strong>Contract:</strong>
 * <ul>
 *   <li>{@link #parse} rejects non-mapping roots with
 *       {@link ca.gc.cra.smartconfig.domain.error.RootTypeException} and malformed text with
 *       {@link ca.gc.cra.smartconfig.domain.error.ConfigSyntaxException} carrying the location.</li>
 *   <li>{@link #serialize} is deterministic: the same tree always yields the same text.</li>
 *   <li>Lossy encodings are documented per adapter and applied consistently.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface FormatAdapter {
  /**
   * Returns the format handled by this adapter.
   *
   * @return format tag
   */
  ConfigFormat format();

  /**
   * Parses raw text into a document.
   *
   * @param text raw document text; blank text yields an empty mapping
   * @param origin path or logical name used in diagnostics
   * @return parsed document
   */
  ConfigDocument parse(String text, String origin);

  /**
   * Serializes a tree.
   *
   * @param value tree to serialize; adapters that need a mapping root reject other kinds
   * @return serialized text ending with a newline
   * @throws ca.gc.cra.smartconfig.domain.error.SerializationException when the format cannot express the tree
   */
  String serialize(ConfigValue value);
}
