package ca.gc.cra.smartconfig.infrastructure.format;

import ca.gc.cra.smartconfig.application.port.FormatAdapter;
import ca.gc.cra.smartconfig.domain.error.ConfigSyntaxException;
import ca.gc.cra.smartconfig.domain.error.RootTypeException;
import ca.gc.cra.smartconfig.domain.error.SerializationException;
import ca.gc.cra.smartconfig.domain.tree.BooleanValue;
import ca.gc.cra.smartconfig.domain.tree.ConfigDocument;
import ca.gc.cra.smartconfig.domain.tree.ConfigFormat;
import ca.gc.cra.smartconfig.domain.tree.ConfigValue;
import ca.gc.cra.smartconfig.domain.tree.MappingValue;
import ca.gc.cra.smartconfig.domain.tree.NullValue;
import ca.gc.cra.smartconfig.domain.tree.NumberValue;
import ca.gc.cra.smartconfig.domain.tree.SequenceValue;
import ca.gc.cra.smartconfig.domain.tree.StringValue;
import java.io.StringReader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * YAML adapter backed by SnakeYAML.
 *
 * <p>Documents are composed into SnakeYAML's node graph and converted directly, so scalars keep full
 * precision and duplicate keys are reported with their line and column. YAML 1.1 timestamps are not
 * resolved: {@code 2024-01-01} loads as a string. Anchors, aliases and {@code <<} merge keys are
 * honoured. Output uses block style with two-space indentation.</p>
 *
 * @since 0.1.0
 */
public final class YamlFormatAdapter implements FormatAdapter {
  private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "on", "y");

  @Override
  public ConfigFormat format() {
    return ConfigFormat.YAML;
  }

  @Override
  public ConfigDocument parse(String text, String origin) {
    Objects.requireNonNull(text, "text");
    Node root;
    try {
      root = loader().compose(new StringReader(text));
    } catch (MarkedYAMLException ex) {
      Mark mark = ex.getProblemMark();
      throw new ConfigSyntaxException(origin, line(mark), column(mark), ex.getProblem(), ex);
    } catch (YAMLException ex) {
      throw new ConfigSyntaxException(origin, -1, -1, ex.getMessage(), ex);
    }
    if (root == null) {
      return new ConfigDocument(MappingValue.EMPTY, ConfigFormat.YAML, origin);
    }
    ConfigValue value = new NodeReader(origin).read(root);
    if (!(value instanceof MappingValue mapping)) {
      throw new RootTypeException(origin, value.kind());
    }
    return new ConfigDocument(mapping, ConfigFormat.YAML, origin);
  }

  @Override
  public String serialize(ConfigValue value) {
    Objects.requireNonNull(value, "value");
    try {
      return dumper().dump(toYamlObject(value));
    } catch (YAMLException ex) {
      throw new SerializationException(ConfigFormat.YAML, "<root>", ex.getMessage(), ex);
    }
  }

  private static Yaml loader() {
    LoaderOptions options = new LoaderOptions();
    options.setAllowDuplicateKeys(false);
    DumperOptions dumperOptions = new DumperOptions();
    return new Yaml(new SafeConstructor(options), new Representer(dumperOptions), dumperOptions, options,
        new NoTimestampResolver());
  }

  private static Yaml dumper() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setSplitLines(false);
    options.setAllowUnicode(true);
    return new Yaml(new Representer(options), options);
  }

  private static Object toYamlObject(ConfigValue value) {
    if (value instanceof MappingValue mapping) {
      Map<String, Object> map = new LinkedHashMap<>();
      mapping.entries().forEach((key, child) -> map.put(key, toYamlObject(child)));
      return map;
    }
    if (value instanceof SequenceValue sequence) {
      List<Object> list = new ArrayList<>(sequence.size());
      sequence.items().forEach(item -> list.add(toYamlObject(item)));
      return list;
    }
    if (value instanceof NumberValue number) {
      if (number.isIntegral()) {
        BigInteger integer = number.value().toBigIntegerExact();
        return integer.bitLength() < 64 ? (Object) integer.longValue() : integer;
      }
      return number.value().stripTrailingZeros();
    }
    if (value instanceof StringValue text) {
      return text.value();
    }
    if (value instanceof BooleanValue bool) {
      return bool.value();
    }
    return null;
  }

  private static int line(Mark mark) {
    return mark == null ? -1 : mark.getLine() + 1;
  }

  private static int column(Mark mark) {
    return mark == null ? -1 : mark.getColumn() + 1;
  }

  /** Converts composed nodes into configuration values for one document. */
  private static final class NodeReader {
    private final String origin;

    private NodeReader(String origin) {
      this.origin = origin;
    }

    private ConfigValue read(Node node) {
      if (node instanceof MappingNode mapping) {
        Map<String, ConfigValue> entries = new LinkedHashMap<>();
        readMapping(mapping, entries, false);
        return new MappingValue(entries);
      }
      if (node instanceof SequenceNode sequence) {
        List<ConfigValue> items = new ArrayList<>(sequence.getValue().size());
        for (Node item : sequence.getValue()) {
          items.add(read(item));
        }
        return new SequenceValue(items);
      }
      return scalar((ScalarNode) node);
    }

    private void readMapping(MappingNode node, Map<String, ConfigValue> entries, boolean merged) {
      List<MappingNode> mergeSources = new ArrayList<>();
      for (NodeTuple tuple : node.getValue()) {
        Node keyNode = tuple.getKeyNode();
        if (Tag.MERGE.equals(keyNode.getTag())) {
          collectMergeSources(tuple.getValueNode(), mergeSources);
          continue;
        }
        if (!(keyNode instanceof ScalarNode scalarKey)) {
          throw error(keyNode, "mapping keys must be scalars");
        }
        String key = scalarKey.getValue();
        if (merged) {
          entries.putIfAbsent(key, read(tuple.getValueNode()));
        } else if (entries.put(key, read(tuple.getValueNode())) != null) {
          throw error(keyNode, "duplicate key '" + key + "'");
        }
      }
      for (MappingNode source : mergeSources) {
        readMapping(source, entries, true);
      }
    }

    private void collectMergeSources(Node value, List<MappingNode> out) {
      if (value instanceof MappingNode mapping) {
        out.add(mapping);
      } else if (value instanceof SequenceNode sequence) {
        for (Node item : sequence.getValue()) {
          if (!(item instanceof MappingNode mapping)) {
            throw error(item, "merge key expects mappings");
          }
          out.add(mapping);
        }
      } else {
        throw error(value, "merge key expects a mapping or a sequence of mappings");
      }
    }

    private ConfigValue scalar(ScalarNode node) {
      String text = node.getValue();
      Tag tag = node.getTag();
      try {
        if (Tag.NULL.equals(tag)) {
          return NullValue.INSTANCE;
        }
        if (Tag.BOOL.equals(tag)) {
          return BooleanValue.of(TRUE_WORDS.contains(text.toLowerCase(Locale.ROOT)));
        }
        if (Tag.INT.equals(tag)) {
          return NumberValue.of(parseInteger(text));
        }
        if (Tag.FLOAT.equals(tag)) {
          return new NumberValue(parseDecimal(text));
        }
      } catch (NumberFormatException ex) {
        throw error(node, "invalid number literal");
      }
      return StringValue.of(text);
    }

    private BigDecimal parseDecimal(String literal) {
      String text = literal.replace("_", "");
      String lower = text.toLowerCase(Locale.ROOT);
      if (lower.endsWith(".inf") || lower.equals(".nan")) {
        throw new NumberFormatException("non-finite number");
      }
      String unsigned = text.startsWith("+") || text.startsWith("-") ? text.substring(1) : text;
      BigDecimal magnitude = unsigned.indexOf(':') >= 0
          ? new BigDecimal(sexagesimal(unsigned))
          : new BigDecimal(unsigned);
      return text.startsWith("-") ? magnitude.negate() : magnitude;
    }

    private BigInteger parseInteger(String literal) {
      String text = literal.replace("_", "");
      int sign = 1;
      if (text.startsWith("-")) {
        sign = -1;
        text = text.substring(1);
      } else if (text.startsWith("+")) {
        text = text.substring(1);
      }
      BigInteger magnitude;
      if (text.startsWith("0b")) {
        magnitude = new BigInteger(text.substring(2), 2);
      } else if (text.startsWith("0x")) {
        magnitude = new BigInteger(text.substring(2), 16);
      } else if (text.length() > 1 && text.startsWith("0")) {
        magnitude = new BigInteger(text.substring(1), 8);
      } else if (text.indexOf(':') >= 0) {
        magnitude = new BigDecimal(sexagesimal(text)).toBigIntegerExact();
      } else {
        magnitude = new BigInteger(text);
      }
      return sign < 0 ? magnitude.negate() : magnitude;
    }

    private String sexagesimal(String text) {
      String[] parts = text.split(":");
      BigDecimal total = BigDecimal.ZERO;
      for (String part : parts) {
        total = total.multiply(BigDecimal.valueOf(60)).add(new BigDecimal(part));
      }
      return total.toPlainString();
    }

    private ConfigSyntaxException error(Node node, String detail) {
      Mark mark = node.getStartMark();
      return new ConfigSyntaxException(origin, line(mark), column(mark), detail, null);
    }
  }

  /** YAML 1.1 implicit resolution without the timestamp rule. */
  private static final class NoTimestampResolver extends Resolver {
    @Override
    protected void addImplicitResolvers() {
      addImplicitResolver(Tag.BOOL, BOOL, "yYnNtTfFoO");
      addImplicitResolver(Tag.INT, INT, "-+0123456789");
      addImplicitResolver(Tag.FLOAT, FLOAT, "-+0123456789.");
      addImplicitResolver(Tag.MERGE, MERGE, "<");
      addImplicitResolver(Tag.NULL, NULL, "~nN\0");
      addImplicitResolver(Tag.NULL, EMPTY, null);
    }
  }
}
