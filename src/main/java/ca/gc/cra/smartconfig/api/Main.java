package ca.gc.cra.smartconfig.api;

import ca.gc.cra.smartconfig.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * smartconfig CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: smartconfig <load|env|merge|validate|template|encrypt|decrypt|backup|"
          + "commit|history|diff|rollback|prune> [options]";
  private static final String HELP_TEXT = """
      smartconfig configuration manager

      Usage:
        smartconfig <command> [key=value ...] [flags]

      Document commands:
        load        Parse a JSON, YAML, TOML or INI document and print or convert it
        env         Like load, resolving ${NAME} placeholders from the environment
        merge       Deep-merge several documents, reporting conflicts
        validate    Check a document against a schema
        template    Generate a skeleton document from a schema
        backup      Copy a document to a timestamped backup

      Vault commands:
        encrypt     Encrypt sensitive fields with AES-256-GCM
        decrypt     Decrypt sensitive fields

      History commands:
        commit      Merge, validate and append a new snapshot
        history     List snapshots, newest first
        diff        Field-level changes between two snapshots
        rollback    Reconstruct the tree of a snapshot
        prune       Drop old snapshots

      Global options:
        config=PATH Settings file (default ./smartconfig.yaml; sections common and <command>)
        --help      Show this message, or a command's help after the command name
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first token that is not a flag names the subcommand
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String command = null;
    List<String> delegate = new ArrayList<>();
    for (String arg : args == null ? new String[0] : args) {
      if (command == null && arg != null && !arg.isBlank() && !arg.startsWith("-") && !arg.contains("=")) {
        command = arg.trim().toLowerCase(Locale.ROOT);
        continue;
      }
      delegate.add(arg);
    }
    String[] delegateArgs = delegate.toArray(String[]::new);

    if (command == null) {
      if (CliInput.wantsHelp(delegateArgs)) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      try {
        if (CliInput.parse(null, delegateArgs).verbose()) {
          LoggingConfigurator.enableVerboseLogging();
        }
        log.error("Missing command");
      } catch (IllegalArgumentException ex) {
        log.error("Missing command; {}", ex.getMessage());
      }
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    return switch (command) {
      case "load", "env", "merge", "validate", "template", "backup" -> DocumentCli.run(command, delegateArgs);
      case "encrypt", "decrypt" -> VaultCli.run(command, delegateArgs);
      case "commit", "history", "diff", "rollback", "prune" -> HistoryCli.run(command, delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
