package ca.gc.cra.sluice.api;

import java.util.Map;

final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /** Removes and returns the {@code config} (or {@code --config}) setting, or {@code null} when absent. */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null) {
      return null;
    }
    String found = null;
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (found == null && value != null && !value.isBlank()) {
        found = value.trim();
      }
    }
    return found;
  }
}
