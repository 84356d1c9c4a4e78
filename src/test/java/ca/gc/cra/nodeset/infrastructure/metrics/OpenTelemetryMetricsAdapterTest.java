package ca.gc.cra.nodeset.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTR = AttributeKey.stringKey("nodeset.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("expand.records.out");
    adapter.increment("expand.records.out");
    adapter.increment("expand.records.out");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "expand.records.out")
        .orElseThrow(() -> new AssertionError("Expected counter metric to be exported"));
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("expand.records.out", point.getAttributes().get(KEY_ATTR));

    AttributeKey<String> serviceName = AttributeKey.stringKey("service.name");
    assertEquals("nodeset-expander", counter.getResource().getAttribute(serviceName));
  }

  @Test
  void observeRecordsHistogramSamples() {
    adapter.observe("expand.clones.per.record", 1L);
    adapter.observe("expand.clones.per.record", 3L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "expand.clones.per.record")
        .orElseThrow(() -> new AssertionError("Expected histogram metric to be exported"));
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4.0, point.getSum());
  }

  @Test
  void sanitizeNameLowercasesAndReplacesInvalidCharacters() {
    assertEquals("expand.records_in", OpenTelemetryMetricsAdapter.sanitizeName("Expand.Records In"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("nodeset.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void noneExporterProducesNoopAdapter() {
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter("none", "")) {
      noop.increment("expand.records.in");
      noop.observe("expand.clones.per.record", 2L);
    }
    assertTrue(reader.collectAllMetrics().isEmpty());
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
