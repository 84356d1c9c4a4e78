package ca.gc.cra.nodeset.application.expand;

import ca.gc.cra.nodeset.application.port.NodeRangeExpander;
import ca.gc.cra.nodeset.application.port.NodeRangeException;
import ca.gc.cra.nodeset.domain.macro.MacroSyntaxError;
import ca.gc.cra.nodeset.domain.macro.MacroSyntaxException;
import ca.gc.cra.nodeset.domain.macro.RangeAwareSplitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> The EXPAND pass: rewrites {@code $EXPAND(ranges)$} into an explicit list of names.
 * <p><strong>Why:</strong> Configuration authors write {@code h[0-63]} once instead of sixty-four members.</p>
 * <p><strong>Role:</strong> Application service used by {@link ObjectDuplicator} and {@link ExpansionPipeline}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Split arguments on commas outside brackets and parentheses.</li>
 *   <li>Enumerate each chunk through the {@link NodeRangeExpander} port.</li>
 *   <li>Concatenate results in declaration order, keeping duplicates, joined by the separator.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share when the expander port is thread-safe.</p>
 * <p><strong>Observability:</strong> Range failures surface as {@link MacroSyntaxException} naming the chunk.</p>
 *
 * @implNote Union here is a list concatenation, not a set union: {@code $EXPAND(b,a,a)$} stays {@code b,a,a}
 * because consumers may rely on repetition counts.
 * @since 0.1.0
 */
public final class ExpandMacroFunction {
  /** Macro-function name handled by this pass. */
  public static final String MACRO_NAME = "EXPAND";
  /** Separator used when none is configured. */
  public static final String DEFAULT_SEPARATOR = ",";

  static final String NESTED_SEPARATOR = ",";

  private final NodeRangeExpander rangeExpander;
  private final String separator;

  /**
   * Creates an EXPAND pass joining results with {@link #DEFAULT_SEPARATOR}.
   *
   * @param rangeExpander node-range port; must not be {@code null}
   */
  public ExpandMacroFunction(NodeRangeExpander rangeExpander) {
    this(rangeExpander, DEFAULT_SEPARATOR);
  }

  /**
   * Creates an EXPAND pass with a custom separator.
   *
   * @param rangeExpander node-range port; must not be {@code null}
   * @param separator text placed between expanded names; must not be {@code null}
   */
  public ExpandMacroFunction(NodeRangeExpander rangeExpander, String separator) {
    this.rangeExpander = Objects.requireNonNull(rangeExpander, "rangeExpander");
    this.separator = Objects.requireNonNull(separator, "separator");
  }

  public String separator() {
    return separator;
  }

  /**
   * Rewrites every EXPAND macro-function in {@code value}.
   *
   * @param value raw property value; must not be {@code null}
   * @return value with EXPAND macros replaced; other text untouched
   * @throws MacroSyntaxException if a macro is malformed or a range is rejected
   */
  public String expand(String value) {
    return expandWith(value, separator);
  }

  /**
   * Applies {@link #expand(String)} to each element, preserving order.
   *
   * @param values raw property values
   * @return new list of expanded values
   * @throws MacroSyntaxException if any value fails to expand
   */
  public List<String> expandAll(List<String> values) {
    List<String> expanded = new ArrayList<>(values.size());
    for (String value : values) {
      expanded.add(expand(value));
    }
    return expanded;
  }

  /**
   * Resolves an argument to its literal names without joining them.
   * Nested EXPAND macros inside {@code argument} are resolved first.
   *
   * @param argument raw macro argument text
   * @return ordered names, duplicates kept
   * @throws MacroSyntaxException if a nested macro is malformed or a range is rejected
   */
  public List<String> resolve(String argument) {
    String flattened = expandWith(argument, NESTED_SEPARATOR);
    List<String> names = new ArrayList<>();
    for (String chunk : RangeAwareSplitter.splitTrimmed(flattened)) {
      if (chunk.isEmpty()) {
        continue;
      }
      try {
        names.addAll(rangeExpander.expand(chunk));
      } catch (NodeRangeException ex) {
        throw new MacroSyntaxException(MacroSyntaxError.INVALID_RANGE_EXPRESSION, chunk, ex);
      }
    }
    return names;
  }

  /**
   * Runs the EXPAND pass joining names with {@code joiner} instead of the configured separator.
   * Used wherever expanded text is split again on commas before being consumed.
   */
  String expandWith(String value, String joiner) {
    return MacroSubstitution.substitute(value, MACRO_NAME, argument -> String.join(joiner, resolve(argument)));
  }
}
