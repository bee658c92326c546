package ca.gc.cra.sluice.domain.stage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Fully resolved description of one executable stage.
 * <p><strong>Why:</strong> Plugin and settings resolution happen elsewhere; the engine only needs what to spawn and
 * in which role.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; collections are defensively copied.</p>
 *
 * @param id stable identifier used for logging and correlation; {@code [A-Za-z0-9._-]+}
 * @param role pipeline role of the stage
 * @param command executable followed by its fixed arguments; never empty
 * @param workingDirectory optional working directory for the process
 * @param environment environment overrides; {@code null} values are not allowed
 * @param config key/value settings materialized for the executable by stage hooks, in declaration order
 * @since 0.1.0
 */
public record StageDescriptor(
    String id,
    StageRole role,
    List<String> command,
    Optional<Path> workingDirectory,
    Map<String, String> environment,
    Map<String, String> config) {

  private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  /**
   * Validates identifiers and copies collections.
   *
   * @throws IllegalArgumentException when the id is malformed or the command is empty
   */
  public StageDescriptor {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(command, "command");
    if (!ID_PATTERN.matcher(id).matches()) {
      throw new IllegalArgumentException("stage id must only contain letters, digits, dot, underscore, or hyphen: "
          + id);
    }
    if (command.isEmpty() || command.get(0) == null || command.get(0).isBlank()) {
      throw new IllegalArgumentException("stage " + id + " must declare a command");
    }
    command = List.copyOf(command);
    workingDirectory = Objects.requireNonNullElse(workingDirectory, Optional.empty());
    environment = environment == null ? Map.of() : Map.copyOf(environment);
    config = config == null ? Map.of() : orderedCopy(config);
  }

  private static Map<String, String> orderedCopy(Map<String, String> source) {
    Map<String, String> copy = new LinkedHashMap<>();
    source.forEach((key, value) -> copy.put(Objects.requireNonNull(key, "config key"),
        Objects.requireNonNull(value, "config value")));
    return Collections.unmodifiableMap(copy);
  }

  /**
   * Convenience factory for a stage without working directory, environment, or config.
   *
   * @param id stage identifier
   * @param role pipeline role
   * @param command executable and arguments
   * @return descriptor
   */
  public static StageDescriptor of(String id, StageRole role, String... command) {
    return new StageDescriptor(id, role, List.of(command), Optional.empty(), Map.of(), Map.of());
  }

  /**
   * Returns the command line extended with arguments contributed at preparation time.
   *
   * @param extra additional arguments appended after the declared command
   * @return new list; caller owns it
   */
  public List<String> commandLine(List<String> extra) {
    List<String> line = new ArrayList<>(command);
    if (extra != null) {
      line.addAll(extra);
    }
    return line;
  }
}
