package ca.gc.cra.smartconfig.domain.tree;

import java.util.Objects;

/**
 * A parsed configuration document: a mapping root, the format it was read from and where it came from.
 *
 * <p>Immutable; {@link #withRoot(MappingValue)} produces an edited copy.</p>
 *
 * @param root document root; always a mapping
 * @param format source format
 * @param origin path or logical name of the source
 * @since 0.1.0
 */
public record ConfigDocument(MappingValue root, ConfigFormat format, String origin) {

  public ConfigDocument {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(format, "format");
    origin = origin == null || origin.isBlank() ? "<inline>" : origin;
  }

  /**
   * Returns a copy of this document with a different root.
   *
   * @param newRoot replacement root
   * @return edited document sharing format and origin
   */
  public ConfigDocument withRoot(MappingValue newRoot) {
    return new ConfigDocument(newRoot, format, origin);
  }
}
