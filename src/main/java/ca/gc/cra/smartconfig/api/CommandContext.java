package ca.gc.cra.smartconfig.api;

import ca.gc.cra.smartconfig.application.port.MetricsPort;
import ca.gc.cra.smartconfig.application.schema.SchemaParser;
import ca.gc.cra.smartconfig.config.CompositionRoot;
import ca.gc.cra.smartconfig.config.ToolSettings;
import ca.gc.cra.smartconfig.domain.schema.Schema;
import ca.gc.cra.smartconfig.domain.tree.ConfigFormat;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.validation.Paths;
import ca.gc.cra.smartconfig.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything one command invocation needs: its effective arguments, parsed settings, wired root and metrics.
 */
final class CommandContext {
  private static final Logger log = LoggerFactory.getLogger(CommandContext.class);

  private final String command;
  private final CliInput input;
  private final Map<String, String> effective;
  private final CompositionRoot root;
  private final MetricsPort metrics;

  CommandContext(
      String command,
      CliInput input,
      Map<String, String> effective,
      CompositionRoot root,
      MetricsPort metrics) {
    this.command = command;
    this.input = input;
    this.effective = effective;
    this.root = root;
    this.metrics = metrics;
  }

  String command() {
    return command;
  }

  CompositionRoot root() {
    return root;
  }

  ToolSettings settings() {
    return root.settings();
  }

  MetricsPort metrics() {
    return metrics;
  }

  boolean has(CliFlag flag) {
    return input.has(flag);
  }

  Optional<String> option(String key) {
    return Optional.ofNullable(Strings.trimToNull(effective.get(key)));
  }

  String requireOption(String key) {
    return option(key).orElseThrow(() -> new IllegalArgumentException(key + " is required"));
  }

  long requireLong(String key) {
    String raw = requireOption(key);
    try {
      return Long.parseLong(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  /**
   * Reads {@code file=PATH} and checks it is a readable file.
   *
   * @return input file
   */
  Path inputFile() {
    return Paths.validateReadableFile("file", Paths.parse("file", requireOption("file")));
  }

  /**
   * Reads {@code sources=a,b,c}, falling back to a single {@code file=PATH}.
   *
   * @return sources, lowest precedence first
   */
  List<Path> sources() {
    List<String> raw = Strings.splitList("sources", effective.get("sources"));
    if (raw.isEmpty()) {
      return List.of(inputFile());
    }
    List<Path> paths = new ArrayList<>(raw.size());
    for (String item : raw) {
      paths.add(Paths.validateReadableFile("sources", Paths.parse("sources", item)));
    }
    return List.copyOf(paths);
  }

  /**
   * Loads {@code schema=PATH} when given, applying the {@code strict} setting.
   *
   * @param required whether a missing {@code schema} argument is an error
   * @return schema, or a permissive one when absent and not required
   * @throws IOException when the schema file cannot be read
   */
  Schema schema(boolean required) throws IOException {
    Optional<String> raw = option("schema");
    if (raw.isEmpty()) {
      if (required) {
        throw new IllegalArgumentException("schema is required");
      }
      return Schema.permissive();
    }
    Path file = Paths.validateReadableFile("schema", Paths.parse("schema", raw.get()));
    Schema schema = new SchemaParser().parse(root.documents().load(file).root());
    return settings().strict() ? schema.withStrict(true) : schema;
  }

  /**
   * Writes a tree to {@code out=PATH} when given, otherwise prints it to stdout.
   *
   * <p>The {@code format} setting overrides the format detected from the output extension; stdout defaults
   * to JSON.</p>
   *
   * @param tree tree to emit
   * @throws IOException when the output file cannot be written
   */
  void emit(ConfigValue tree) throws IOException {
    Optional<ConfigFormat> format = settings().format();
    Optional<String> out = option("out");
    if (out.isPresent()) {
      Path target = Paths.parse("out", out.get());
      root.documents().save(tree, target, format.orElse(null));
      CliPrinter.println("Wrote " + target);
      return;
    }
    ConfigFormat stdoutFormat = format.orElse(ConfigFormat.JSON);
    log.debug("Printing {} result as {}", command, stdoutFormat);
    CliPrinter.printDocument(root.documents().render(tree, stdoutFormat));
  }
}
