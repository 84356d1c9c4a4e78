package ca.gc.cra.nodeset.application.expand;

import ca.gc.cra.nodeset.domain.macro.Macro;
import ca.gc.cra.nodeset.domain.macro.MacroScanner;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * <strong>What:</strong> Generic rewrite pass replacing one kind of macro-function in a value.
 * <p><strong>Why:</strong> EXPAND is one instance of "find {@code $NAME(args)$}, replace with f(args)"; keeping the
 * loop generic lets new macro-functions reuse it.</p>
 * <p><strong>Role:</strong> Application service used by {@link ExpandMacroFunction}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Copy literal text and non-matching macros through unchanged.</li>
 *   <li>Require matching macro-functions to be closed with {@code $}.</li>
 *   <li>Splice in the replacement for each matching macro, left to right.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> One scan per macro; O(n) in the value length plus replacement cost.</p>
 *
 * @since 0.1.0
 */
public final class MacroSubstitution {
  private MacroSubstitution() {
    // Utility
  }

  /**
   * Replaces every macro-function named {@code targetName} in {@code text}.
   *
   * @param text value to rewrite; must not be {@code null}
   * @param targetName exact, case-sensitive macro name (e.g. {@code EXPAND})
   * @param replacement maps the raw argument text to its substitution
   * @return rewritten value; identical to {@code text} when nothing matched
   * @throws ca.gc.cra.nodeset.domain.macro.MacroSyntaxException if a macro is malformed or a matching
   *     macro-function is not closed with {@code $}
   */
  public static String substitute(String text, String targetName, UnaryOperator<String> replacement) {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(targetName, "targetName");
    Objects.requireNonNull(replacement, "replacement");

    StringBuilder out = new StringBuilder(text.length());
    int cursor = 0;
    while (cursor < text.length()) {
      Optional<Macro> found = MacroScanner.scan(text, cursor);
      if (found.isEmpty()) {
        out.append(text, cursor, text.length());
        break;
      }
      Macro macro = found.get();
      if (!macro.isFunction(targetName)) {
        out.append(text, cursor, macro.next());
      } else {
        MacroScanner.requireClosedWithDollar(macro);
        out.append(text, cursor, macro.start());
        out.append(replacement.apply(macro.argument().text()));
      }
      cursor = macro.next();
    }
    return out.toString();
  }
}
