package ca.gc.cra.sluice.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter for SLUICE runs: an OTLP gRPC periodic reader, or a no-op meter when export is
 * disabled or cannot be initialized.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.sluice";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static Bootstrap initialize(TelemetrySettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (!settings.enabled()) {
      log.info("Metrics export disabled (metricsExporter=none)");
      return Bootstrap.noop();
    }
    try {
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder()
          .setEndpoint(settings.endpoint())
          .build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      Bootstrap bootstrap = build(reader, parseResourceAttributes(settings.resourceAttributes()));
      log.info("Metrics exporting over OTLP to {}", settings.endpoint());
      return bootstrap;
    } catch (RuntimeException ex) {
      log.error("Cannot initialize OpenTelemetry metrics; continuing without export", ex);
      return Bootstrap.noop();
    }
  }

  static Bootstrap forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static Bootstrap build(MetricReader reader, Attributes extraResource) {
    String version = serviceVersion();
    AttributesBuilder attributes = Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "sluice")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), version)
        .put(AttributeKey.stringKey("service.instance.id"), ManagementFactory.getRuntimeMXBean().getName());
    Resource resource = Resource.getDefault()
        .merge(Resource.create(attributes.build()))
        .merge(Resource.create(extraResource));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new Bootstrap(meter, provider);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String entry : raw.split(",")) {
      int eq = entry.indexOf('=');
      String key = eq < 0 ? "" : entry.substring(0, eq).trim();
      String value = eq < 0 ? "" : entry.substring(eq + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        if (!entry.isBlank()) {
          log.warn("Ignoring malformed resource attribute '{}'", entry.trim());
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/ca.gc.cra/sluice/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        return props.getProperty("version", "0.0.0-dev");
      }
    } catch (IOException ex) {
      log.debug("Cannot read pom.properties for version detection", ex);
    }
    return "0.0.0-dev";
  }

  /** Meter plus the provider that must be flushed and shut down with it; the provider is absent in no-op mode. */
  static final class Bootstrap implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private Bootstrap(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static Bootstrap noop() {
      return new Bootstrap(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        awaitResult(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        awaitResult(provider.shutdown(), "shutdown");
      }
    }

    private static void awaitResult(CompletableResultCode result, String action) {
      result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry meter provider {} did not complete within {}s", action, SHUTDOWN_TIMEOUT_SECONDS);
      }
    }
  }
}
