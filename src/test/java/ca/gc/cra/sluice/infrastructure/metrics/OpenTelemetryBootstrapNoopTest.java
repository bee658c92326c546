package ca.gc.cra.sluice.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {

  @Test
  void exporterNoneFallsBackToNoop() {
    OpenTelemetryBootstrap.Bootstrap result = OpenTelemetryBootstrap.initialize(TelemetrySettings.disabled());

    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void noopAdapterAcceptsMetrics() {
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(TelemetrySettings.disabled())) {
      adapter.increment("stage.started");
      adapter.observe("stage.output.lines", 3);
      assertTrue(adapter.isNoop());
    }
  }

  @Test
  void settingsValidateExporter() {
    assertEquals("otlp", new TelemetrySettings(null, null, null).exporter());
    assertEquals(TelemetrySettings.DEFAULT_ENDPOINT, new TelemetrySettings("OTLP", " ", null).endpoint());
    assertThrows(IllegalArgumentException.class, () -> new TelemetrySettings("prometheus", null, null));
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=prod, team = etl ,broken,=x");

    assertEquals(2, attributes.size());
    assertEquals("prod", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("etl", attributes.get(AttributeKey.stringKey("team")));
  }
}
