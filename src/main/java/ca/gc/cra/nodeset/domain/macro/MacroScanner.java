package ca.gc.cra.nodeset.domain.macro;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Locates and classifies the next macro token in a property value.
 * <p><strong>Why:</strong> Both the EXPAND and DUPLICATE passes need the same span and argument boundaries,
 * including nested parentheses that regular expressions cannot balance.</p>
 * <p><strong>Role:</strong> Domain parser shared by {@code MacroSubstitution} and {@code ObjectDuplicator}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Track parenthesis depth to find the single top-level argument group.</li>
 *   <li>Terminate tokens on {@code $} or whitespace outside parentheses.</li>
 *   <li>Reject unbalanced or repeated argument groups with {@link MacroSyntaxException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Single forward pass, O(n) in the scanned span.</p>
 * <p><strong>Observability:</strong> No logging; failures carry the offending substring.</p>
 *
 * @implNote Whitespace terminates a token so that bare macros such as {@code $HOSTNAME} followed by a space are
 * still reported and can be copied through untouched by later passes.
 * @since 0.1.0
 */
public final class MacroScanner {
  private static final char MARKER = '$';

  private MacroScanner() {
    // Utility
  }

  /**
   * Scans {@code text} for its first macro.
   *
   * @param text value to scan; must not be {@code null}
   * @return first macro, or empty when the text holds no {@code $}
   * @throws MacroSyntaxException if the macro's parentheses are malformed
   */
  public static Optional<Macro> scan(String text) {
    return scan(text, 0);
  }

  /**
   * Scans {@code text} for the first macro starting at or after {@code fromIndex}.
   * Offsets in the result are relative to the whole of {@code text}.
   *
   * @param text value to scan; must not be {@code null}
   * @param fromIndex index to start searching from
   * @return first macro at or after {@code fromIndex}, or empty when none remains
   * @throws MacroSyntaxException if the macro's parentheses are malformed
   */
  public static Optional<Macro> scan(String text, int fromIndex) {
    Objects.requireNonNull(text, "text");
    int start = text.indexOf(MARKER, Math.max(0, fromIndex));
    if (start < 0) {
      return Optional.empty();
    }

    int depth = 0;
    int open = -1;
    int close = -1;
    int end = text.length() - 1;
    boolean closedWithDollar = false;

    for (int i = start + 1; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '(') {
        depth++;
        if (open < 0) {
          open = i;
        } else if (close >= 0) {
          throw new MacroSyntaxException(
              MacroSyntaxError.MULTIPLE_ARGUMENT_GROUPS, text.substring(start, i + 1));
        }
      } else if (c == ')') {
        if (depth == 0) {
          throw new MacroSyntaxException(
              MacroSyntaxError.UNEXPECTED_CLOSING_PARENTHESIS, text.substring(start, i + 1));
        }
        depth--;
        if (depth == 0 && close < 0) {
          close = i;
        }
      } else if (depth == 0 && Character.isWhitespace(c)) {
        end = i;
        break;
      } else if (depth == 0 && c == MARKER) {
        end = i;
        closedWithDollar = true;
        break;
      }
    }

    if (open >= 0 && close < 0) {
      throw new MacroSyntaxException(MacroSyntaxError.UNCLOSED_ARGUMENT_GROUP, text.substring(start));
    }

    MacroArgument argument = open >= 0
        ? new MacroArgument(text.substring(open + 1, close), open, close)
        : null;
    String raw = text.substring(start, end + 1);
    return Optional.of(new Macro(start, end, nameOf(raw), argument, closedWithDollar, raw));
  }

  /**
   * Rejects a macro-function that was not terminated by a second {@code $} placed directly after its
   * closing parenthesis. Text between {@code )} and {@code $} (as in {@code $EXPAND(a)x$}) is rejected too.
   *
   * @param macro macro to check
   * @return the same macro for fluent call sites
   * @throws MacroSyntaxException of kind {@link MacroSyntaxError#MISSING_TERMINATING_DOLLAR}
   */
  public static Macro requireClosedWithDollar(Macro macro) {
    boolean dollarFollowsArgument =
        macro.argument() == null || macro.end() == macro.argument().closeIndex() + 1;
    if (!macro.closedWithDollar() || !dollarFollowsArgument) {
      throw new MacroSyntaxException(MacroSyntaxError.MISSING_TERMINATING_DOLLAR, macro.text());
    }
    return macro;
  }

  private static String nameOf(String raw) {
    int i = 1;
    while (i < raw.length()) {
      char c = raw.charAt(i);
      if (c == '(' || c == MARKER || Character.isWhitespace(c)) {
        break;
      }
      i++;
    }
    return raw.substring(1, i);
  }
}
