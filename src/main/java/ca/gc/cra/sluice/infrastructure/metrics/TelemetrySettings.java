package ca.gc.cra.sluice.infrastructure.metrics;

import java.util.Locale;

/**
 * Exporter choice for run metrics.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes extra resource attributes as {@code key=value} pairs separated by commas; may be blank
 * @since 0.1.0
 */
public record TelemetrySettings(String exporter, String endpoint, String resourceAttributes) {
  public static final String EXPORTER_OTLP = "otlp";
  public static final String EXPORTER_NONE = "none";
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public TelemetrySettings {
    exporter = exporter == null || exporter.isBlank() ? EXPORTER_OTLP : exporter.trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals(EXPORTER_OTLP) && !exporter.equals(EXPORTER_NONE)) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /** Settings that disable export entirely. */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(EXPORTER_NONE, null, null);
  }

  public boolean enabled() {
    return EXPORTER_OTLP.equals(exporter);
  }
}
