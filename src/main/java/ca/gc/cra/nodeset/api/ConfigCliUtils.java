package ca.gc.cra.nodeset.api;

import java.util.Map;

/**
 * Helpers for mixing CLI flags with YAML/map based configuration.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} path argument, if any.
   *
   * @param args mutable CLI key/value map
   * @return trimmed path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
