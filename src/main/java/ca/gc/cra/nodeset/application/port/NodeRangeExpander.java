package ca.gc.cra.nodeset.application.port;

import java.util.List;

/**
 * <strong>What:</strong> Port that enumerates one compact node-range token into literal names.
 * <p><strong>Why:</strong> Keeps range grammar (brackets, steps, padding) outside the macro core so it can be
 * swapped or stubbed.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code BracketNodeRangeExpander} or test doubles.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return names in enumeration order, e.g. {@code h[0-2]} to {@code h0, h1, h2}.</li>
 *   <li>Return a single-element list for tokens without range syntax.</li>
 *   <li>Reject malformed bracket syntax with {@link NodeRangeException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent calls.</p>
 * <p><strong>Performance:</strong> Output size is bounded by the implementation's range limit.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface NodeRangeExpander {
  /**
   * Expands a single range token.
   *
   * @param token trimmed token without top-level commas; never {@code null}
   * @return ordered literal names; never {@code null}
   * @throws NodeRangeException if the token uses malformed range syntax
   */
  List<String> expand(String token) throws NodeRangeException;
}
