package ca.gc.cra.sluice.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges flat run settings with precedence CLI over YAML over defaults.
 *
 * <p>Keys that no source defines as a default are rejected so typos surface instead of being ignored.</p>
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings.
   *
   * @param yaml settings from the YAML file, if any
   * @param cli settings from {@code key=value} arguments
   * @param defaults default settings; their key set defines the known keys
   * @param warn receives a message for every CLI value overriding YAML; may be {@code null}
   * @return immutable effective settings
   * @throws IllegalArgumentException when an unknown key is supplied
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      requireKnown(defaultsCopy, entry.getKey(), "YAML");
      merged.put(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      requireKnown(defaultsCopy, key, "CLI");
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }
    return Map.copyOf(merged);
  }

  private static void requireKnown(Map<String, String> defaults, String key, String source) {
    if (!defaults.isEmpty() && !defaults.containsKey(key)) {
      throw new IllegalArgumentException("Unknown " + source + " setting: " + key);
    }
  }
}
