package ca.gc.cra.nodeset.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through the CLI or YAML configuration.
 * <p><strong>Why:</strong> Separators and names end up spliced into property values; control characters there
 * would corrupt the records handed to the configuration loader.</p>
 * <p><strong>Role:</strong> Domain support utilities invoked before the pipeline is assembled.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value is non-empty and free of control characters without trimming it.
   * Used for separators, where surrounding spaces are significant.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text; must not be {@code null}
   * @return the value unchanged
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is empty or contains ISO control characters
   */
  public static String requireNoControl(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (raw.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be empty"));
    }
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return raw;
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
