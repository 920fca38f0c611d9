package ca.gc.cra.smartconfig.application.port;

/**
 * <strong>What:</strong> Port for recording counters and observations about configuration operations.
 * <p><strong>Why:</strong> Keeps the pipeline independent of the metrics backend (OpenTelemetry or no-op).</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters in {@code infrastructure.metrics}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls.</p>
 * <p><strong>Observability:</strong> Keys use dotted names such as {@code config.commit.success}.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the counter identified by {@code key} by one.
   *
   * @param key metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value observed value, units defined by the caller (for example milliseconds)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
