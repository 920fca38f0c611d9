package ca.gc.cra.smartconfig.infrastructure.metrics;

import ca.gc.cra.smartconfig.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Metrics adapter that forwards counters and histograms to OpenTelemetry. Instruments are created lazily,
 * one per metric key, and cached.
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> COMMAND = AttributeKey.stringKey("smartconfig.command");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final Attributes attributes;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured exporter.
   *
   * @param command CLI command recorded as an attribute on every measurement
   */
  public OpenTelemetryMetricsAdapter(String command) {
    this(OpenTelemetryBootstrap.initialize(), command);
  }

  /**
   * Creates an adapter that reports to an explicit reader, such as an in-memory reader in tests.
   *
   * @param reader metric reader
   * @param command CLI command attribute
   * @return adapter
   */
  public static OpenTelemetryMetricsAdapter forReader(MetricReader reader, String command) {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader), command);
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap, String command) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    this.attributes = command == null ? Attributes.empty() : Attributes.of(COMMAND, command);
  }

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter).add(1, attributes);
  }

  @Override
  public void observe(String key, long value) {
    histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram).record(value, attributes);
  }

  /**
   * Indicates whether measurements are discarded.
   *
   * @return {@code true} when no exporter is configured
   */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  /** Pushes pending measurements to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private LongCounter createCounter(String key) {
    return meter.counterBuilder(key).setUnit("1").setDescription("smartconfig counter " + key).build();
  }

  private LongHistogram createHistogram(String key) {
    return meter.histogramBuilder(key).ofLongs().setDescription("smartconfig observation " + key).build();
  }
}
