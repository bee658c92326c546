package ca.gc.cra.sluice.api;

import ca.gc.cra.sluice.config.RunConfig;
import ca.gc.cra.sluice.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.sluice.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Validates the metrics settings of a run and turns them into {@link TelemetrySettings}. */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static TelemetrySettings settings(RunConfig config) {
    String endpoint = config.otelEndpoint();
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
    }
    String attributes = config.otelResourceAttributes();
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii(RunConfig.OTEL_RESOURCE_ATTRIBUTES, attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    TelemetrySettings settings = new TelemetrySettings(config.metricsExporter(), endpoint, attributes);
    log.debug("Metrics exporter {} (endpoint {})", settings.exporter(), settings.endpoint());
    return settings;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
