package ca.gc.cra.smartconfig.api;

import ca.gc.cra.smartconfig.config.CompositionRoot;
import ca.gc.cra.smartconfig.config.DefaultsForCommand;
import ca.gc.cra.smartconfig.config.SettingsLoader;
import ca.gc.cra.smartconfig.config.SettingsMerger;
import ca.gc.cra.smartconfig.config.ToolSettings;
import ca.gc.cra.smartconfig.domain.error.CommitRejectedException;
import ca.gc.cra.smartconfig.domain.error.ConfigException;
import ca.gc.cra.smartconfig.domain.error.LockTimeoutException;
import ca.gc.cra.smartconfig.domain.error.UnsupportedFormatException;
import ca.gc.cra.smartconfig.domain.error.VaultException;
import ca.gc.cra.smartconfig.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.smartconfig.logging.LoggingConfigurator;
import ca.gc.cra.smartconfig.logging.Logs;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared command runner: parses arguments, layers settings (CLI over YAML over defaults), wires the
 * composition root and maps failures to {@link ExitCode}s.
 */
final class CliSupport {
  private static final Logger log = LoggerFactory.getLogger(CliSupport.class);
  private static final Function<ToolSettings, CompositionRoot> DEFAULT_ROOT_FACTORY = CompositionRoot::new;

  private static volatile Function<ToolSettings, CompositionRoot> rootFactory = DEFAULT_ROOT_FACTORY;

  /** Body of one command. */
  @FunctionalInterface
  interface CommandAction {
    ExitCode run(CommandContext context) throws IOException;
  }

  private CliSupport() {}

  /**
   * Runs {@code action} for {@code command} with fully prepared settings.
   *
   * @param command command name
   * @param args command arguments, without the command token
   * @param usage one-line usage printed on argument errors
   * @param help help text printed for {@code --help}
   * @param action command body
   * @return exit code
   */
  static ExitCode execute(String command, String[] args, String usage, String help, CommandAction action) {
    if (CliInput.wantsHelp(args)) {
      CliPrinter.println(help.stripTrailing());
      return ExitCode.SUCCESS;
    }
    CliInput input;
    try {
      input = CliInput.parse(command, args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", command);
    }

    Map<String, String> kv = input.options();
    String configPath = extractConfigPath(kv);
    Path settingsFile = Path.of(configPath == null ? SettingsLoader.DEFAULT_FILE : configPath);
    if (configPath != null && !Files.exists(settingsFile)) {
      log.error("Settings file does not exist: {}", settingsFile);
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }
    Optional<Map<String, String>> yaml;
    try {
      yaml = SettingsLoader.load(settingsFile, command);
      yaml.ifPresent(found -> log.debug("Loaded {} setting(s) from {}", found.size(), settingsFile));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid settings file: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read settings file {}", settingsFile, ex);
      return ExitCode.IO_ERROR;
    }

    Map<String, String> effective;
    ToolSettings settings;
    try {
      effective = SettingsMerger.buildEffectiveSettings(
          command, yaml, kv, DefaultsForCommand.asFlatMap(command), log::warn);
      settings = ToolSettings.fromMap(effective);
      TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException | UnsupportedFormatException ex) {
      log.error("Invalid {} settings: {}", command, ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }
    log.debug("Effective {} settings: historyDir={}, lockTimeout={}, markers={}, policy={}",
        command, settings.historyDir(), settings.lockTimeout(), settings.markers(), settings.mergePolicy());

    CompositionRoot root = rootFactory.apply(settings);
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(command)) {
      CommandContext context = new CommandContext(command, input, effective, root, metrics);
      return action.run(context);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", command, ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    } catch (Exception ex) {
      return handleFailure(command, ex);
    }
  }

  /**
   * Maps a failure to its exit code and logs it.
   *
   * @param command command name for the log message
   * @param ex failure
   * @return exit code
   */
  static ExitCode handleFailure(String command, Exception ex) {
    if (ex instanceof UnsupportedFormatException unsupported) {
      log.error("{}: {}", command, unsupported.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    if (ex instanceof CommitRejectedException rejected) {
      log.error("{} rejected: {}", command, rejected.getMessage());
      return ExitCode.VALIDATION_FAILED;
    }
    if (ex instanceof LockTimeoutException timeout) {
      log.error("{}: {}", command, timeout.getMessage());
      return ExitCode.LOCK_TIMEOUT;
    }
    if (ex instanceof VaultException vault) {
      log.error("{} security failure: {}", command, vault.getMessage());
      return ExitCode.SECURITY_ERROR;
    }
    if (ex instanceof ConfigException config) {
      log.error("{} failed: {}", command, Logs.truncate(config.getMessage(), 512));
      return ExitCode.CONFIG_ERROR;
    }
    if (ex instanceof InterruptedIOException interrupted) {
      Thread.currentThread().interrupt();
      log.error("{} interrupted", command, interrupted);
      return ExitCode.INTERRUPTED;
    }
    if (ex instanceof IOException io) {
      log.error("{} I/O failure: {}", command, io.toString(), io);
      return ExitCode.IO_ERROR;
    }
    if (ex instanceof UncheckedIOException unchecked) {
      return handleFailure(command, unchecked.getCause());
    }
    log.error("Unexpected failure in {}", command, ex);
    return ExitCode.RUNTIME_FAILURE;
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static void setRootFactoryForTesting(Function<ToolSettings, CompositionRoot> factory) {
    rootFactory = factory;
  }

  static void clearRootFactory() {
    rootFactory = DEFAULT_ROOT_FACTORY;
  }
}
