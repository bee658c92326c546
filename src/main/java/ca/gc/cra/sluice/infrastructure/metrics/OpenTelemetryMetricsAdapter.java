package ca.gc.cra.sluice.infrastructure.metrics;

import ca.gc.cra.sluice.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link MetricsPort} backed by OpenTelemetry: increments become counters and observations become histograms, one
 * instrument per key. Each data point carries the original key as {@code sluice.metric.key}.
 *
 * <p>Close the adapter at the end of a run to flush pending exports.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("sluice.metric.key");
  private static final String FALLBACK_METRIC_NAME = "sluice.metric";

  private final OpenTelemetryBootstrap.Bootstrap bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  public OpenTelemetryMetricsAdapter(TelemetrySettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Bootstrap bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, k -> meter.counterBuilder(sanitizeName(k))
            .setUnit("1")
            .setDescription("SLUICE counter for " + k)
            .build())
        .add(1, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, k -> meter.histogramBuilder(sanitizeName(k))
            .ofLongs()
            .setDescription("SLUICE observation for " + k)
            .build())
        .record(value, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  boolean isNoop() {
    return bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  static String sanitizeName(String key) {
    String trimmed = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_METRIC_NAME;
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return name.toString();
  }
}
