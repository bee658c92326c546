package ca.gc.cra.sluice.config;

import ca.gc.cra.sluice.application.port.context.ExecutionContext;
import java.util.LinkedHashMap;
import java.util.Map;

/** Default values for every flat run setting, as strings so they merge with YAML and CLI input. */
public final class RunDefaults {
  private static final Map<String, String> DEFAULTS = build();

  private RunDefaults() {}

  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> build() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(RunConfig.BUFFER_SIZE, Integer.toString(ExecutionContext.DEFAULT_BUFFER_SIZE));
    map.put(RunConfig.RUN_ID, "");
    map.put(RunConfig.JOB_NAME, "");
    map.put(RunConfig.RUN_DIR, "");
    map.put(RunConfig.RUN_LOG, "");
    map.put(RunConfig.TRACE_STDOUT, "false");
    map.put(RunConfig.METRICS_EXPORTER, "none");
    map.put(RunConfig.OTEL_ENDPOINT, "");
    map.put(RunConfig.OTEL_RESOURCE_ATTRIBUTES, "");
    return Map.copyOf(map);
  }
}
