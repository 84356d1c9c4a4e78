package ca.gc.cra.nodeset.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code expand})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "expand" -> buildExpandDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    ExpanderConfig defaults = ExpanderConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", defaults.metricsExporter());
    map.put("otelEndpoint", defaults.otelEndpoint());
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildExpandDefaults() {
    ExpanderConfig defaults = ExpanderConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("separator", defaults.separator());
    map.put("maxRangeSize", Integer.toString(defaults.maxRangeSize()));
    map.put("format", defaults.outputFormat().name().toLowerCase(Locale.ROOT));
    map.put("dryRun", "false");
    map.put("allowOverwrite", "false");
    return Map.copyOf(map);
  }
}
