package ca.gc.cra.sluice.api;

import ca.gc.cra.sluice.validation.Strings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** Parses {@code key=value} CLI settings, rejecting malformed keys and control characters. */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^-{0,2}[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Parses settings in order; a repeated key keeps its last value.
   *
   * @throws IllegalArgumentException when an argument is not {@code key=value} or contains control characters
   */
  public static Map<String, String> toMap(List<String> args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int eq = arg.indexOf('=');
      if (eq <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, eq).trim();
      String value = arg.substring(eq + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (value.indexOf('\0') >= 0 || value.chars().anyMatch(Character::isISOControl)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      map.put(key, value.isEmpty() ? value : Strings.requireNonBlank(key, value));
    }
    return map;
  }
}
