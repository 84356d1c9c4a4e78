package ca.gc.cra.nodeset.domain.macro;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits macro arguments on a separator that is not nested inside {@code [...]} or {@code (...)}.
 * <p>Node-range syntax uses commas inside brackets ({@code h[1,3-5]}) and nested macro-functions carry their own
 * parenthesized arguments, so a plain {@link String#split(String)} would cut both apart.</p>
 *
 * @since 0.1.0
 */
public final class RangeAwareSplitter {
  private RangeAwareSplitter() {
    // Utility
  }

  /**
   * Splits on top-level commas.
   *
   * @param value text to split; must not be {@code null}
   * @return chunks in order, untrimmed; at least one element
   */
  public static List<String> split(String value) {
    return split(value, ',');
  }

  /**
   * Splits on a top-level separator character.
   *
   * @param value text to split; must not be {@code null}
   * @param separator single separator character
   * @return chunks in order, untrimmed; at least one element
   */
  public static List<String> split(String value, char separator) {
    Objects.requireNonNull(value, "value");
    List<String> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int brackets = 0;
    int parens = 0;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '[' -> brackets++;
        case ']' -> brackets = Math.max(0, brackets - 1);
        case '(' -> parens++;
        case ')' -> parens = Math.max(0, parens - 1);
        default -> {
          if (c == separator && brackets == 0 && parens == 0) {
            chunks.add(current.toString());
            current.setLength(0);
            continue;
          }
        }
      }
      current.append(c);
    }
    chunks.add(current.toString());
    return chunks;
  }

  /**
   * Splits on top-level commas and trims every chunk.
   *
   * @param value text to split; must not be {@code null}
   * @return trimmed chunks in order; blank chunks are kept as empty strings
   */
  public static List<String> splitTrimmed(String value) {
    List<String> chunks = split(value);
    List<String> trimmed = new ArrayList<>(chunks.size());
    for (String chunk : chunks) {
      trimmed.add(chunk.strip());
    }
    return trimmed;
  }
}
