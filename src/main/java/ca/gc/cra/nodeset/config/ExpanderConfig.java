package ca.gc.cra.nodeset.config;

import ca.gc.cra.nodeset.application.expand.ExpandMacroFunction;
import ca.gc.cra.nodeset.infrastructure.range.BracketNodeRangeExpander;
import ca.gc.cra.nodeset.validation.Numbers;
import ca.gc.cra.nodeset.validation.Strings;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable settings for one expansion run.
 * <p><strong>Why:</strong> Collects the separator, range ceiling, document paths, and metrics exporter in one
 * validated value before the pipeline is wired.</p>
 * <p><strong>Role:</strong> Configuration aggregate built from the merged CLI/YAML/default map.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param input record document to read, when running from the CLI
 * @param output destination file; empty writes to stdout
 * @param separator text joining EXPAND results; never empty
 * @param maxRangeSize ceiling on names produced by one range token
 * @param outputFormat serialization of the expanded records
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otelEndpoint OTLP endpoint; blank uses the exporter default
 * @since 0.1.0
 */
public record ExpanderConfig(
    Optional<Path> input,
    Optional<Path> output,
    String separator,
    int maxRangeSize,
    OutputFormat outputFormat,
    String metricsExporter,
    String otelEndpoint) {

  /** Upper bound accepted for {@code maxRangeSize}. */
  public static final int MAX_RANGE_SIZE_LIMIT = 10_000_000;

  /**
   * Validates components.
   *
   * @throws NullPointerException if any component is {@code null}
   * @throws IllegalArgumentException if a component is out of range
   */
  public ExpanderConfig {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(output, "output");
    Strings.requireNoControl("separator", separator);
    Numbers.requireRange("maxRangeSize", maxRangeSize, 1, MAX_RANGE_SIZE_LIMIT);
    Objects.requireNonNull(outputFormat, "outputFormat");
    metricsExporter = normalizeExporter(metricsExporter);
    otelEndpoint = otelEndpoint == null ? "" : otelEndpoint.trim();
  }

  /**
   * Returns the built-in defaults.
   *
   * @return default configuration: comma separator, YAML output, metrics disabled
   */
  public static ExpanderConfig defaults() {
    return new ExpanderConfig(
        Optional.empty(),
        Optional.empty(),
        ExpandMacroFunction.DEFAULT_SEPARATOR,
        BracketNodeRangeExpander.DEFAULT_MAX_RANGE_SIZE,
        OutputFormat.YAML,
        "none",
        "");
  }

  /**
   * Builds a configuration from a flat key/value map, falling back to {@link #defaults()} per key.
   *
   * @param options merged options ({@code in}, {@code out}, {@code separator}, {@code maxRangeSize},
   *     {@code format}, {@code metricsExporter}, {@code otelEndpoint})
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed
   */
  public static ExpanderConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ExpanderConfig defaults = defaults();

    Optional<Path> input = optionalPath(options.get("in"));
    Optional<Path> output = optionalPath(options.get("out"));

    String separator = options.get("separator");
    if (separator == null || separator.isEmpty()) {
      separator = defaults.separator();
    }

    int maxRangeSize = defaults.maxRangeSize();
    String rawMax = options.get("maxRangeSize");
    if (rawMax != null && !rawMax.isBlank()) {
      maxRangeSize = Numbers.parseIntInRange("maxRangeSize", rawMax, 1, MAX_RANGE_SIZE_LIMIT);
    }

    OutputFormat format = OutputFormat.fromString(options.get("format"));
    String exporter = options.getOrDefault("metricsExporter", defaults.metricsExporter());
    String endpoint = options.getOrDefault("otelEndpoint", defaults.otelEndpoint());

    return new ExpanderConfig(input, output, separator, maxRangeSize, format, exporter, endpoint);
  }

  private static Optional<Path> optionalPath(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Path.of(Strings.requireNonBlank("path", raw)));
  }

  private static String normalizeExporter(String raw) {
    if (raw == null || raw.isBlank()) {
      return "none";
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("none") && !normalized.equals("otlp")) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + raw + ")");
    }
    return normalized;
  }
}
