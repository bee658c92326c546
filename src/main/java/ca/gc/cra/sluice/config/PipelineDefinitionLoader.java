package ca.gc.cra.sluice.config;

import ca.gc.cra.sluice.domain.stage.StageDescriptor;
import ca.gc.cra.sluice.domain.stage.StageRole;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the ordered {@code stages} list of a YAML section into {@link StageDescriptor}s.
 *
 * <p>Each entry needs {@code id}, {@code role} and {@code command}; {@code command} is either a list or a string split
 * on whitespace. Optional keys are {@code args} (list), {@code workdir} (resolved against the YAML file's directory),
 * {@code env} and {@code config} (flat mappings).</p>
 */
public final class PipelineDefinitionLoader {
  static final String STAGES_KEY = "stages";

  private PipelineDefinitionLoader() {}

  /**
   * Loads the stages of {@code section}.
   *
   * @throws IllegalArgumentException when the list is missing or an entry is malformed
   */
  public static List<StageDescriptor> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Map<String, Object> root = YamlConfigLoader.readRoot(path);
    Object selected = YamlConfigLoader.findSection(root, section);
    if (selected == null) {
      throw new IllegalArgumentException("YAML config " + path + " has no '" + section + "' section");
    }
    Object rawStages = YamlConfigLoader.asMap(selected, section).get(STAGES_KEY);
    if (!(rawStages instanceof List<?> entries)) {
      throw new IllegalArgumentException(section + "." + STAGES_KEY + " must be a list of stages");
    }
    Path baseDirectory = path.toAbsolutePath().normalize().getParent();
    List<StageDescriptor> stages = new ArrayList<>(entries.size());
    Set<String> ids = new HashSet<>();
    for (int i = 0; i < entries.size(); i++) {
      String context = section + "." + STAGES_KEY + "[" + i + "]";
      StageDescriptor descriptor = parseStage(YamlConfigLoader.asMap(entries.get(i), context), context,
          baseDirectory);
      if (!ids.add(descriptor.id())) {
        throw new IllegalArgumentException("Duplicate stage id: " + descriptor.id());
      }
      stages.add(descriptor);
    }
    return List.copyOf(stages);
  }

  private static StageDescriptor parseStage(Map<String, Object> entry, String context, Path baseDirectory) {
    String id = requireScalar(entry, "id", context);
    StageRole role;
    try {
      role = StageRole.parse(requireScalar(entry, "role", context));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(context + ": " + ex.getMessage(), ex);
    }
    List<String> command = new ArrayList<>(tokens(entry.get("command"), context + ".command", true));
    command.addAll(tokens(entry.get("args"), context + ".args", false));
    Optional<Path> workdir = Optional.ofNullable(entry.get("workdir"))
        .map(Object::toString)
        .filter(value -> !value.isBlank())
        .map(value -> resolve(baseDirectory, value.trim()));
    try {
      return new StageDescriptor(id, role, command, workdir,
          flatMap(entry.get("env"), context + ".env"), flatMap(entry.get("config"), context + ".config"));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(context + ": " + ex.getMessage(), ex);
    }
  }

  private static String requireScalar(Map<String, Object> entry, String key, String context) {
    Object value = entry.get(key);
    if (value == null || value instanceof Map<?, ?> || value instanceof List<?> || value.toString().isBlank()) {
      throw new IllegalArgumentException(context + "." + key + " is required");
    }
    return value.toString().trim();
  }

  private static List<String> tokens(Object value, String context, boolean required) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException(context + " is required");
      }
      return List.of();
    }
    if (value instanceof List<?> list) {
      List<String> result = new ArrayList<>(list.size());
      for (Object item : list) {
        if (item == null || item instanceof Map<?, ?> || item instanceof List<?>) {
          throw new IllegalArgumentException(context + " must only contain scalars");
        }
        result.add(item.toString());
      }
      return result;
    }
    if (value instanceof Map<?, ?>) {
      throw new IllegalArgumentException(context + " must be a string or a list");
    }
    String text = value.toString().trim();
    return text.isEmpty() ? List.of() : List.of(text.split("\\s+"));
  }

  private static Map<String, String> flatMap(Object value, String context) {
    if (value == null) {
      return Map.of();
    }
    Map<String, String> result = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : YamlConfigLoader.asMap(value, context).entrySet()) {
      Object item = entry.getValue();
      if (item instanceof Map<?, ?> || item instanceof List<?>) {
        throw new IllegalArgumentException(context + "." + entry.getKey() + " must be a scalar");
      }
      result.put(entry.getKey(), item == null ? "" : item.toString());
    }
    return result;
  }

  private static Path resolve(Path baseDirectory, String raw) {
    Path candidate = Path.of(raw);
    if (candidate.isAbsolute() || baseDirectory == null) {
      return candidate.normalize();
    }
    return baseDirectory.resolve(candidate).normalize();
  }
}
