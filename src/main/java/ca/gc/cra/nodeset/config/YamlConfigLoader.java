package ca.gc.cra.nodeset.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads expander settings from a YAML file.
 *
 * <p>The document is a mapping of sections. {@code common} applies to every mode and the section named
 * after the mode overrides it. Each section maps setting names to scalar values; the names are the ones
 * {@link DefaultsForMode} knows plus {@code in} and {@code out}. Anything else is rejected so that a
 * misspelt setting never passes silently.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";
  private static final List<String> PATH_KEYS = List.of("in", "out");

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the {@code mode} section.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode whose section overrides {@code common} (e.g. {@code expand})
   * @return merged settings; empty when the file is absent
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or names an unknown setting
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    Set<String> knownKeys = new LinkedHashSet<>(DefaultsForMode.asFlatMap(normalizedMode).keySet());
    knownKeys.addAll(PATH_KEYS);

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> sections = mapping(document, "root");
    Map<String, String> merged = new LinkedHashMap<>();
    for (String name : List.of(COMMON, normalizedMode)) {
      Object section = sections.get(name);
      if (section != null) {
        merged.putAll(settings(section, name, knownKeys));
      }
    }
    return Optional.of(Map.copyOf(merged));
  }

  private static Map<String, String> settings(Object section, String name, Set<String> knownKeys) {
    Map<String, String> settings = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : mapping(section, name).entrySet()) {
      String key = entry.getKey();
      if (!knownKeys.contains(key)) {
        throw new IllegalArgumentException(
            "Unknown setting '" + key + "' in section " + name + "; expected one of " + knownKeys);
      }
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException("Setting " + name + '.' + key + " must be a scalar");
      }
      settings.put(key, value == null ? "" : value.toString());
    }
    return settings;
  }

  // Section names are matched case-insensitively; setting names are not.
  private static Map<String, Object> mapping(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    boolean root = "root".equals(context);
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      String normalized = root ? key.trim().toLowerCase(Locale.ROOT) : key;
      if (map.put(normalized, entry.getValue()) != null) {
        throw new IllegalArgumentException(context + " section repeats key " + key);
      }
    }
    return map;
  }
}
