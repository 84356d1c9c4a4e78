package ca.gc.cra.nodeset.infrastructure.range;

import ca.gc.cra.nodeset.application.port.NodeRangeExpander;
import ca.gc.cra.nodeset.application.port.NodeRangeException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Default {@link NodeRangeExpander} for bracketed numeric node ranges.
 * <p><strong>Why:</strong> Gives the CLI and embedding loaders a working range primitive for the common
 * {@code prefix[1-3,7]suffix} notation.</p>
 * <p><strong>Role:</strong> Infrastructure adapter behind the node-range port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enumerate {@code N}, {@code A-B}, and {@code A-B/STEP} items in declaration order.</li>
 *   <li>Keep zero padding from lower bounds such as {@code 01-10}.</li>
 *   <li>Combine several bracket groups as a cartesian product, leftmost group varying slowest.</li>
 *   <li>Reject unbalanced brackets, empty groups, bad bounds, and oversized expansions.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Output bounded by {@code maxRangeSize} names per token.</p>
 *
 * @implNote A bracket group is a set: repeated indices inside one group are emitted once. Set operators
 * ({@code !}, {@code &}, {@code ^}) are not interpreted and stay part of the literal text.
 * @since 0.1.0
 */
public final class BracketNodeRangeExpander implements NodeRangeExpander {
  /** Default ceiling on the number of names a single token may produce. */
  public static final int DEFAULT_MAX_RANGE_SIZE = 100_000;

  private final int maxRangeSize;

  /**
   * Creates an expander with {@link #DEFAULT_MAX_RANGE_SIZE}.
   */
  public BracketNodeRangeExpander() {
    this(DEFAULT_MAX_RANGE_SIZE);
  }

  /**
   * Creates an expander with a custom output ceiling.
   *
   * @param maxRangeSize maximum names per token; must be positive
   */
  public BracketNodeRangeExpander(int maxRangeSize) {
    if (maxRangeSize <= 0) {
      throw new IllegalArgumentException("maxRangeSize must be positive");
    }
    this.maxRangeSize = maxRangeSize;
  }

  public int maxRangeSize() {
    return maxRangeSize;
  }

  @Override
  public List<String> expand(String token) throws NodeRangeException {
    Objects.requireNonNull(token, "token");
    List<List<String>> parts = parse(token);

    long total = 1;
    for (List<String> part : parts) {
      total *= part.size();
      if (total > maxRangeSize) {
        throw new NodeRangeException("range " + token + " expands to more than " + maxRangeSize + " names");
      }
    }

    List<String> names = new ArrayList<>((int) total);
    names.add("");
    for (List<String> part : parts) {
      List<String> next = new ArrayList<>(names.size() * part.size());
      for (String head : names) {
        for (String piece : part) {
          next.add(head + piece);
        }
      }
      names = next;
    }
    return names;
  }

  private List<List<String>> parse(String token) throws NodeRangeException {
    List<List<String>> parts = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < token.length()) {
      char c = token.charAt(i);
      if (c == ']') {
        throw new NodeRangeException("unmatched ']' in " + token);
      }
      if (c != '[') {
        literal.append(c);
        i++;
        continue;
      }
      int close = token.indexOf(']', i + 1);
      if (close < 0) {
        throw new NodeRangeException("unclosed '[' in " + token);
      }
      String group = token.substring(i + 1, close);
      if (group.indexOf('[') >= 0) {
        throw new NodeRangeException("nested '[' in " + token);
      }
      if (literal.length() > 0) {
        parts.add(List.of(literal.toString()));
        literal.setLength(0);
      }
      parts.add(parseGroup(token, group));
      i = close + 1;
    }
    if (literal.length() > 0 || parts.isEmpty()) {
      parts.add(List.of(literal.toString()));
    }
    return parts;
  }

  private List<String> parseGroup(String token, String group) throws NodeRangeException {
    if (group.isBlank()) {
      throw new NodeRangeException("empty range group in " + token);
    }
    Set<String> values = new LinkedHashSet<>();
    for (String rawItem : group.split(",", -1)) {
      String item = rawItem.strip();
      if (item.isEmpty()) {
        throw new NodeRangeException("empty range item in " + token);
      }
      addItem(token, item, values);
      if (values.size() > maxRangeSize) {
        throw new NodeRangeException("range " + token + " expands to more than " + maxRangeSize + " names");
      }
    }
    return List.copyOf(values);
  }

  private void addItem(String token, String item, Set<String> values) throws NodeRangeException {
    int step = 1;
    String bounds = item;
    int slash = item.indexOf('/');
    if (slash >= 0) {
      bounds = item.substring(0, slash);
      step = parseNumber(token, item.substring(slash + 1));
      if (step <= 0) {
        throw new NodeRangeException("range step must be positive in " + token);
      }
    }

    int dash = bounds.indexOf('-');
    if (dash < 0) {
      if (slash >= 0) {
        throw new NodeRangeException("step without range in " + token);
      }
      parseNumber(token, bounds);
      values.add(bounds);
      return;
    }

    String lowText = bounds.substring(0, dash);
    String highText = bounds.substring(dash + 1);
    int low = parseNumber(token, lowText);
    int high = parseNumber(token, highText);
    if (low > high) {
      throw new NodeRangeException("reversed range " + item + " in " + token);
    }
    if ((long) (high - low) / step + 1 > maxRangeSize) {
      throw new NodeRangeException("range " + token + " expands to more than " + maxRangeSize + " names");
    }
    int width = lowText.length() > 1 && lowText.charAt(0) == '0' ? lowText.length() : 0;
    for (long n = low; n <= high; n += step) {
      values.add(pad(n, width));
    }
  }

  private static int parseNumber(String token, String text) throws NodeRangeException {
    if (text.isEmpty()) {
      throw new NodeRangeException("missing range bound in " + token);
    }
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c < '0' || c > '9') {
        throw new NodeRangeException("non-numeric range bound '" + text + "' in " + token);
      }
    }
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException ex) {
      throw new NodeRangeException("range bound out of bounds '" + text + "' in " + token, ex);
    }
  }

  private static String pad(long value, int width) {
    String digits = Long.toString(value);
    if (digits.length() >= width) {
      return digits;
    }
    return "0".repeat(width - digits.length()) + digits;
  }
}
