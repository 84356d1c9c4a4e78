package ca.gc.cra.nodeset.domain.macro;

import java.util.Optional;

/**
 * <strong>What:</strong> Span of one {@code $}-prefixed token found by {@link MacroScanner}.
 * <p><strong>Role:</strong> Domain value consumed by the substitution and duplication passes.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param start index of the leading {@code $}
 * @param end inclusive index of the terminating character (closing {@code $}, whitespace, or last character)
 * @param name identifier following {@code $} up to the first {@code (}, whitespace, or {@code $}
 * @param argument argument group, or {@code null} for bare macros
 * @param closedWithDollar {@code true} when a second {@code $} terminated the token
 * @param text raw substring from {@code start} to {@code end} inclusive
 * @since 0.1.0
 */
public record Macro(
    int start, int end, String name, MacroArgument argument, boolean closedWithDollar, String text) {

  /**
   * Returns the argument group when the macro is a macro-function.
   *
   * @return argument group, empty for bare macros
   */
  public Optional<MacroArgument> arguments() {
    return Optional.ofNullable(argument);
  }

  /**
   * Indicates whether this macro is a macro-function named {@code functionName}.
   *
   * @param functionName exact, case-sensitive name such as {@code EXPAND}
   * @return {@code true} when the names match and an argument group is present
   */
  public boolean isFunction(String functionName) {
    return argument != null && name.equals(functionName);
  }

  /**
   * Returns the index just past this macro.
   *
   * @return {@code end + 1}
   */
  public int next() {
    return end + 1;
  }
}
