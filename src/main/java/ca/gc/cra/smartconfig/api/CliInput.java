package ca.gc.cra.smartconfig.api;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Arguments of one smartconfig invocation after the command token: {@link CliFlag} switches and
 * {@code name=value} options.
 *
 * <p>Option names may carry a leading {@code --} ({@code --out=x} is {@code out=x}). A value keeps everything
 * after the first {@code '='}, so {@code sources=a.yaml,b=c.yaml} is one option. A blank value is kept so it
 * can clear a setting inherited from the settings file.</p>
 */
final class CliInput {
  private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private final Set<CliFlag> flags;
  private final Map<String, String> options;

  private CliInput(Set<CliFlag> flags, Map<String, String> options) {
    this.flags = flags;
    this.options = options;
  }

  /**
   * Parses the arguments given to {@code command}.
   *
   * @param command subcommand name, or {@code null} when none was given
   * @param args arguments after the command token; {@code null} and blank entries are ignored
   * @return parsed input
   * @throws IllegalArgumentException for an unknown flag, a flag the command does not take, a token that is
   *     neither flag nor option, or an option given twice
   */
  static CliInput parse(String command, String[] args) {
    Set<CliFlag> flags = EnumSet.noneOf(CliFlag.class);
    Map<String, String> options = new LinkedHashMap<>();
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String arg = raw.trim();
        int idx = arg.indexOf('=');
        if (idx < 0) {
          flags.add(flag(command, arg));
        } else {
          addOption(options, arg.substring(0, idx).trim(), arg.substring(idx + 1).trim(), raw);
        }
      }
    }
    return new CliInput(Collections.unmodifiableSet(flags), Collections.unmodifiableMap(options));
  }

  /**
   * Scans for a help switch without validating anything else, so help still prints next to bad arguments.
   *
   * @param args raw arguments
   * @return {@code true} when help was requested
   */
  static boolean wantsHelp(String[] args) {
    if (args == null) {
      return false;
    }
    for (String arg : args) {
      if (arg != null && !arg.isBlank() && CliFlag.fromToken(arg).filter(CliFlag.HELP::equals).isPresent()) {
        return true;
      }
    }
    return false;
  }

  boolean has(CliFlag flag) {
    return flags.contains(flag);
  }

  boolean help() {
    return has(CliFlag.HELP);
  }

  boolean verbose() {
    return has(CliFlag.VERBOSE);
  }

  /**
   * Returns a mutable copy of the options in the order given.
   *
   * @return name to value
   */
  Map<String, String> options() {
    return new LinkedHashMap<>(options);
  }

  private static CliFlag flag(String command, String arg) {
    if (!arg.startsWith("-") && !arg.equalsIgnoreCase("help")) {
      throw new IllegalArgumentException("argument must be name=value or a flag (was '" + arg + "')");
    }
    CliFlag flag = CliFlag.fromToken(arg)
        .orElseThrow(() -> new IllegalArgumentException("unknown flag " + arg));
    if (!flag.appliesTo(command)) {
      String target = command == null ? "without a command" : "to " + command;
      throw new IllegalArgumentException(flag.token() + " does not apply " + target);
    }
    return flag;
  }

  private static void addOption(Map<String, String> options, String rawName, String value, String raw) {
    String name = rawName.startsWith("--") ? rawName.substring(2) : rawName;
    if (!NAME_PATTERN.matcher(name).matches()) {
      throw new IllegalArgumentException("invalid option name in '" + raw.trim() + "'");
    }
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("option " + name + " must not contain null bytes");
    }
    if (options.put(name, value) != null) {
      throw new IllegalArgumentException("option " + name + " given more than once");
    }
  }
}
