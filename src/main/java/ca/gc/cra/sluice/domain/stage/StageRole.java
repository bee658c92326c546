package ca.gc.cra.sluice.domain.stage;

import java.util.Locale;

/**
 * <strong>What:</strong> Closed set of pipeline roles a stage can play.
 * <p><strong>Why:</strong> Fixes every producer/consumer combination at construction so topology checks never see
 * an ad hoc flag pairing.</p>
 * <p><strong>Role:</strong> Domain value carried by {@link StageDescriptor} and every stage.</p>
 * <ul>
 *   <li>{@link #EXTRACTOR}: produces stdout for downstream, reads nothing.</li>
 *   <li>{@link #MAPPER}: consumes upstream stdin and produces stdout.</li>
 *   <li>{@link #LOADER}: consumes upstream stdin, produces nothing downstream.</li>
 *   <li>{@link #COMMAND}: side-effecting command with no pipeline stdio role.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum StageRole {
  EXTRACTOR(true, false),
  MAPPER(true, true),
  LOADER(false, true),
  COMMAND(false, false);

  private final boolean producer;
  private final boolean consumer;

  StageRole(boolean producer, boolean consumer) {
    this.producer = producer;
    this.consumer = consumer;
  }

  /**
   * Indicates whether the stage emits stdout meant for the next stage.
   *
   * @return {@code true} for extractors and mappers
   */
  public boolean producer() {
    return producer;
  }

  /**
   * Indicates whether the stage requires stdin from the previous stage.
   *
   * @return {@code true} for mappers and loaders
   */
  public boolean consumer() {
    return consumer;
  }

  /**
   * Lower-case label used in verdict payloads and log attributes.
   *
   * @return label such as {@code extractor}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a role label, accepting the plural forms used by plugin catalogues ({@code extractors}).
   *
   * @param raw role label; case-insensitive
   * @return matching role
   * @throws IllegalArgumentException when the label is blank or unknown
   */
  public static StageRole parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("stage role must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    if (normalized.endsWith("S")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return switch (normalized) {
      case "EXTRACTOR", "TAP" -> EXTRACTOR;
      case "MAPPER" -> MAPPER;
      case "LOADER", "TARGET" -> LOADER;
      case "COMMAND" -> COMMAND;
      default -> throw new IllegalArgumentException("Unknown stage role: " + raw);
    };
  }
}
