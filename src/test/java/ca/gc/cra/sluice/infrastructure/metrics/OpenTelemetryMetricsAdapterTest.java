package ca.gc.cra.sluice.infrastructure.metrics;

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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
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

  private MetricData metric(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported: " + metrics));
  }

  @Test
  void incrementRecordsCounterWithKeyAndServiceResource() {
    adapter.increment("stage.started");
    adapter.increment("stage.started");
    adapter.increment("stage.started");
    adapter.forceFlush();

    MetricData counter = metric("stage.started");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("stage.started", point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY_ATTRIBUTE));

    assertEquals("sluice", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("run.duration.millis", 40);
    adapter.observe("run.duration.millis", 60);

    MetricData histogram = metric("run.duration.millis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2, point.getCount());
    assertEquals(100.0, point.getSum());
  }

  @Test
  void adapterFromTestingBootstrapIsNotNoop() {
    assertFalse(adapter.isNoop());
  }

  @Test
  void sanitizeNameKeepsInstrumentNamesValid() {
    assertEquals("run.failure.output_limit", OpenTelemetryMetricsAdapter.sanitizeName("run.failure.output_limit"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("stage_output_lines", OpenTelemetryMetricsAdapter.sanitizeName("Stage Output Lines"));
    assertEquals("sluice.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }
}
