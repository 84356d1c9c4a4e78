package ca.gc.cra.nodeset.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Serialization formats for expanded record documents.
 * <p><strong>Role:</strong> Configuration enum consumed by {@code RecordDocumentWriter}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum OutputFormat {
  /** YAML sequence of mappings, the same shape the reader accepts. */
  YAML,
  /** One JSON object per line; every property is an array of strings. */
  NDJSON;

  /**
   * Parses a string into an {@link OutputFormat}, defaulting to {@link #YAML} when blank.
   *
   * @param value textual representation such as {@code "yaml"} or {@code "ndjson"}
   * @return parsed format
   * @throws IllegalArgumentException if the string does not match a known format
   */
  public static OutputFormat fromString(String value) {
    if (value == null || value.isBlank()) {
      return YAML;
    }
    try {
      return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown format: " + value, ex);
    }
  }
}
