package ca.gc.cra.smartconfig.infrastructure.format;

import ca.gc.cra.smartconfig.application.port.DocumentStorePort;
import ca.gc.cra.smartconfig.application.port.FormatAdapter;
import ca.gc.cra.smartconfig.domain.error.UnsupportedFormatException;
import ca.gc.cra.smartconfig.domain.tree.ConfigDocument;
import ca.gc.cra.smartconfig.domain.tree.ConfigFormat;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.infrastructure.persistence.io.AtomicFileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-backed {@link DocumentStorePort} dispatching to one {@link FormatAdapter} per format.
 *
 * @since 0.1.0
 */
public final class FormatRegistry implements DocumentStorePort {
  private static final Logger log = LoggerFactory.getLogger(FormatRegistry.class);
  private static final char BOM = '\uFEFF';

  private final Map<ConfigFormat, FormatAdapter> adapters = new EnumMap<>(ConfigFormat.class);

  /** Creates a registry with the JSON, YAML, TOML and INI adapters. */
  public FormatRegistry() {
    this(List.of(new JsonFormatAdapter(), new YamlFormatAdapter(), new TomlFormatAdapter(), new IniFormatAdapter()));
  }

  /**
   * Creates a registry from explicit adapters.
   *
   * @param adapters adapters; a later adapter for the same format replaces an earlier one
   */
  public FormatRegistry(List<? extends FormatAdapter> adapters) {
    for (FormatAdapter adapter : adapters) {
      this.adapters.put(adapter.format(), adapter);
    }
  }

  /**
   * Returns the adapter for a format.
   *
   * @param format format tag
   * @return adapter
   * @throws UnsupportedFormatException when no adapter is registered
   */
  public FormatAdapter adapter(ConfigFormat format) {
    FormatAdapter adapter = adapters.get(Objects.requireNonNull(format, "format"));
    if (adapter == null) {
      throw new UnsupportedFormatException(format.name());
    }
    return adapter;
  }

  @Override
  public ConfigDocument load(Path file) throws IOException {
    ConfigFormat format = ConfigFormat.fromPath(file);
    String text = Files.readString(file, StandardCharsets.UTF_8);
    if (!text.isEmpty() && text.charAt(0) == BOM) {
      text = text.substring(1);
    }
    log.debug("Parsing {} as {}", file, format);
    return adapter(format).parse(text, file.toString());
  }

  @Override
  public ConfigDocument parse(String text, ConfigFormat format, String origin) {
    return adapter(format).parse(text, origin);
  }

  @Override
  public String render(ConfigValue value, ConfigFormat format) {
    return adapter(format).serialize(value);
  }

  @Override
  public void save(ConfigValue value, Path file, ConfigFormat format) throws IOException {
    ConfigFormat target = format == null ? ConfigFormat.fromPath(file) : format;
    String text = render(value, target);
    AtomicFileWriter.write(file, text.getBytes(StandardCharsets.UTF_8));
    log.info("Wrote {} document to {}", target, file);
  }
}
