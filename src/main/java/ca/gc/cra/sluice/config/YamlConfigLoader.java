package ca.gc.cra.sluice.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Reads flat run settings from a SLUICE YAML document.
 * <p><strong>Layout:</strong> Settings under {@code common} apply to every section; settings under the requested
 * section (for example {@code run}) override them. Nested mappings flatten to dotted keys. The {@code stages} list is
 * skipped here and read by {@link PipelineDefinitionLoader}.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";
  private static final Set<String> STRUCTURED_KEYS = Set.of("stages");

  private YamlConfigLoader() {}

  /**
   * Loads the flattened settings for a section.
   *
   * @param path YAML file
   * @param section section merged over {@code common}
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or uses unsupported shapes
   */
  public static Optional<Map<String, String>> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Map<String, Object> root = readRoot(path);
    Map<String, String> flattened = new LinkedHashMap<>();
    Object common = findSection(root, COMMON_SECTION);
    if (common != null) {
      flatten(asMap(common, COMMON_SECTION), "", flattened);
    }
    String normalized = section.trim().toLowerCase(Locale.ROOT);
    Object selected = findSection(root, normalized);
    if (selected != null) {
      flatten(asMap(selected, normalized), "", flattened);
    }
    return Optional.of(Map.copyOf(flattened));
  }

  static Map<String, Object> readRoot(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Map.of();
      }
      return asMap(document, "root");
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path + ": " + ex.getMessage(), ex);
    }
  }

  static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains a non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  static Object findSection(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      if (prefix.isEmpty() && STRUCTURED_KEYS.contains(key)) {
        continue;
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for setting " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
