package ca.gc.cra.smartconfig.domain.tree;

import ca.gc.cra.smartconfig.domain.error.UnsupportedFormatException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Serialization formats understood by the format adapters.
 *
 * @since 0.1.0
 */
public enum ConfigFormat {
  JSON("json"),
  YAML("yaml", "yml"),
  TOML("toml"),
  INI("ini");

  private final List<String> extensions;

  ConfigFormat(String... extensions) {
    this.extensions = List.of(extensions);
  }

  /**
   * Returns the file extensions associated with this format, preferred extension first.
   *
   * @return lower-case extensions without the dot
   */
  public List<String> extensions() {
    return extensions;
  }

  /**
   * Resolves a format from a tag such as {@code "yaml"} or {@code "YML"}.
   *
   * @param tag format tag or extension
   * @return matching format
   * @throws UnsupportedFormatException when the tag is unknown
   */
  public static ConfigFormat fromTag(String tag) {
    if (tag != null) {
      String normalized = tag.trim().toLowerCase(Locale.ROOT);
      if (normalized.startsWith(".")) {
        normalized = normalized.substring(1);
      }
      for (ConfigFormat format : values()) {
        if (format.name().equalsIgnoreCase(normalized) || format.extensions.contains(normalized)) {
          return format;
        }
      }
    }
    throw new UnsupportedFormatException(tag);
  }

  /**
   * Detects the format of a file from its extension.
   *
   * @param path file path
   * @return matching format
   * @throws UnsupportedFormatException when the extension is missing or unknown
   */
  public static ConfigFormat fromPath(Path path) {
    Path fileName = path.getFileName();
    String name = fileName == null ? "" : fileName.toString();
    int dot = name.lastIndexOf('.');
    if (dot < 0 || dot == name.length() - 1) {
      throw new UnsupportedFormatException("<none>", path.toString());
    }
    String extension = name.substring(dot + 1);
    try {
      return fromTag(extension);
    } catch (UnsupportedFormatException ex) {
      throw new UnsupportedFormatException(extension, path.toString());
    }
  }
}
