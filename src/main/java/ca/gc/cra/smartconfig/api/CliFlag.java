package ca.gc.cra.smartconfig.api;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Switches accepted on the smartconfig command line, with the commands each one applies to.
 */
enum CliFlag {
  HELP("--help", Set.of("-h", "help"), Set.of()),
  VERBOSE("--verbose", Set.of("-v"), Set.of()),
  MASK("--mask", Set.of(), Set.of("load", "env")),
  FAIL_ON_CONFLICT("--fail-on-conflict", Set.of(), Set.of("merge")),
  REQUIRED_ONLY("--required-only", Set.of(), Set.of("template")),
  DECRYPT("--decrypt", Set.of(), Set.of("rollback"));

  private final String token;
  private final Set<String> aliases;
  private final Set<String> commands;

  CliFlag(String token, Set<String> aliases, Set<String> commands) {
    this.token = token;
    this.aliases = aliases;
    this.commands = commands;
  }

  String token() {
    return token;
  }

  /**
   * Indicates whether the flag may be given to {@code command}. Flags without a command list are global.
   *
   * @param command subcommand name, or {@code null} before a command is chosen
   * @return {@code true} when accepted
   */
  boolean appliesTo(String command) {
    return commands.isEmpty() || (command != null && commands.contains(command));
  }

  static Optional<CliFlag> fromToken(String raw) {
    String lower = raw.trim().toLowerCase(Locale.ROOT);
    for (CliFlag flag : values()) {
      if (flag.token.equals(lower) || flag.aliases.contains(lower)) {
        return Optional.of(flag);
      }
    }
    return Optional.empty();
  }
}
