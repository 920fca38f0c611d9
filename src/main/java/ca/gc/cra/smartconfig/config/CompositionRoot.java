package ca.gc.cra.smartconfig.config;

import ca.gc.cra.smartconfig.application.history.VersionHistory;
import ca.gc.cra.smartconfig.application.pipeline.BackupUseCase;
import ca.gc.cra.smartconfig.application.pipeline.ConfigPipeline;
import ca.gc.cra.smartconfig.application.port.ClockPort;
import ca.gc.cra.smartconfig.application.port.MetricsPort;
import ca.gc.cra.smartconfig.application.secret.SecretVault;
import ca.gc.cra.smartconfig.domain.schema.Schema;
import ca.gc.cra.smartconfig.infrastructure.format.FormatRegistry;
import ca.gc.cra.smartconfig.infrastructure.persistence.FileHistoryStore;
import ca.gc.cra.smartconfig.infrastructure.persistence.JsonSnapshotCodec;
import ca.gc.cra.smartconfig.infrastructure.secret.VaultKeyLoader;
import ca.gc.cra.smartconfig.infrastructure.time.SystemClockAdapter;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> Central composition root that wires smartconfig use cases to concrete adapters.
 * <p><strong>Role:</strong> Translates {@link ToolSettings} into runnable pipelines, history stores and key
 * loaders.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances and are
 * not synchronized.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final ToolSettings settings;
  private final Function<String, String> env;
  private final ClockPort clock;
  private final FormatRegistry documents = new FormatRegistry();

  /**
   * Creates a composition root reading the process environment and the system clock.
   *
   * @param settings effective settings
   */
  public CompositionRoot(ToolSettings settings) {
    this(settings, System::getenv, new SystemClockAdapter());
  }

  /**
   * Creates a composition root with explicit environment and clock, for tests.
   *
   * @param settings effective settings
   * @param env environment lookup used for placeholders and key variables
   * @param clock clock used for snapshot timestamps and backup names
   */
  public CompositionRoot(ToolSettings settings, Function<String, String> env, ClockPort clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.env = Objects.requireNonNull(env, "env");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ToolSettings settings() {
    return settings;
  }

  public FormatRegistry documents() {
    return documents;
  }

  /**
   * Builds the load/merge/validate/commit pipeline.
   *
   * @param metrics metrics sink for this invocation
   * @return pipeline
   */
  public ConfigPipeline pipeline(MetricsPort metrics) {
    return new ConfigPipeline(documents, metrics, env);
  }

  /**
   * Opens the version history under {@link ToolSettings#historyDir()}.
   *
   * @param metrics metrics sink for this invocation
   * @param schema schema enforced on commit
   * @return version history
   */
  public VersionHistory history(MetricsPort metrics, Schema schema) {
    return VersionHistory.builder(new FileHistoryStore(settings.historyDir(), clock), new JsonSnapshotCodec())
        .schema(schema)
        .markers(settings.markers())
        .clock(clock)
        .metrics(metrics)
        .lockTimeout(settings.lockTimeout())
        .build();
  }

  public SecretVault vault(MetricsPort metrics) {
    return new SecretVault(metrics);
  }

  public VaultKeyLoader vaultKeys() {
    return new VaultKeyLoader(env);
  }

  public BackupUseCase backups() {
    return new BackupUseCase(clock);
  }
}
