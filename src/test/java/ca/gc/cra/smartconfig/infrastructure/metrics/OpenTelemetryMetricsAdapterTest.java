package ca.gc.cra.smartconfig.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = OpenTelemetryMetricsAdapter.forReader(reader, "commit");
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  private MetricData metric(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream()
        .filter(m -> m.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("Expected metric " + name));
  }

  @Test
  void incrementRecordsCounterWithCommandAttribute() {
    adapter.increment("config.commit.success");
    adapter.increment("config.commit.success");
    adapter.forceFlush();

    MetricData counter = metric("config.commit.success");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("commit", point.getAttributes().get(AttributeKey.stringKey("smartconfig.command")));
    assertEquals("smartconfig", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    assertFalse(adapter.isNoop());
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("config.commit.duration.ms", 12);
    adapter.observe("config.commit.duration.ms", 30);

    MetricData histogram = metric("config.commit.duration.ms");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(42.0, point.getSum());
  }

  @Test
  void noneExporterYieldsNoopAdapter() {
    OpenTelemetryBootstrap.BootstrapResult result =
        OpenTelemetryBootstrap.initialize(Map.of("OTEL_METRICS_EXPORTER", "none")::get);
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(result, "load")) {
      noop.increment("config.parse.success");
      noop.forceFlush();
      assertTrue(noop.isNoop());
    }
  }

  @Test
  void unknownExporterFallsBackToNone() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from("zipkin"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(" OTLP "));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from(null));
  }
}
