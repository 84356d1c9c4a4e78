package ca.gc.cra.nodeset.application.expand;

import ca.gc.cra.nodeset.domain.macro.Macro;
import ca.gc.cra.nodeset.domain.macro.MacroScanner;
import ca.gc.cra.nodeset.domain.macro.RangeAwareSplitter;
import ca.gc.cra.nodeset.domain.record.ConfigRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Expands {@code $DUPLICATE(values)$} macros into one cloned record per value.
 * <p><strong>Why:</strong> A single templated definition (e.g. one host per rack node) replaces many copies.</p>
 * <p><strong>Role:</strong> First stage of {@link ExpansionPipeline}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve nested EXPAND macros inside DUPLICATE arguments before splitting.</li>
 *   <li>Grow the clone list to the largest DUPLICATE group seen so far.</li>
 *   <li>Broadcast the last value of smaller groups into clones they did not spawn.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; each call builds its own {@link CloneSet}.</p>
 * <p><strong>Performance:</strong> O(clones x values) string appends per record.</p>
 * <p><strong>Observability:</strong> Logs at DEBUG when a DUPLICATE group grows the clone list.</p>
 *
 * @implNote Two DUPLICATE groups of sizes 3 and 2 on different properties yield 3 clones; the third clone repeats
 * the second value of the 2-way group.
 * @since 0.1.0
 */
public final class ObjectDuplicator {
  private static final Logger log = LoggerFactory.getLogger(ObjectDuplicator.class);

  /** Macro-function name handled by this pass. */
  public static final String MACRO_NAME = "DUPLICATE";

  private final ExpandMacroFunction expander;

  /**
   * Creates a duplicator resolving nested EXPAND macros with {@code expander}.
   *
   * @param expander EXPAND pass; must not be {@code null}
   */
  public ObjectDuplicator(ExpandMacroFunction expander) {
    this.expander = Objects.requireNonNull(expander, "expander");
  }

  /**
   * Clones {@code record} once per DUPLICATE value.
   *
   * @param record source record; never mutated
   * @return mutable list of clones, or a single copy of {@code record} when it holds no DUPLICATE macro
   * @throws ca.gc.cra.nodeset.domain.macro.MacroSyntaxException if any value holds a malformed macro
   */
  public List<ConfigRecord> duplicate(ConfigRecord record) {
    Objects.requireNonNull(record, "record");
    CloneSet clones = new CloneSet(record);
    for (String property : record.propertyNames()) {
      List<String> values = record.values(property);
      for (int i = 0; i < values.size(); i++) {
        String value = values.get(i);
        if (containsDuplicate(value)) {
          rebuild(clones, property, i, value);
        }
      }
    }
    if (clones.isEmpty()) {
      List<ConfigRecord> single = new ArrayList<>(1);
      single.add(record.copy());
      return single;
    }
    return clones.clones();
  }

  private void rebuild(CloneSet clones, String property, int index, String value) {
    clones.reset(property, index);
    int cursor = 0;
    Optional<Macro> found = MacroScanner.scan(value, cursor);
    while (found.isPresent()) {
      Macro macro = found.get();
      if (macro.isFunction(MACRO_NAME)) {
        MacroScanner.requireClosedWithDollar(macro);
        String prefix = value.substring(cursor, macro.start());
        List<String> literals = literals(macro.argument().text());
        int created = clones.broadcastOrExtend(property, index, prefix, literals);
        if (created > 0 && log.isDebugEnabled()) {
          log.debug("DUPLICATE on {}[{}] added {} clone(s); total {}", property, index, created, clones.size());
        }
      } else {
        clones.appendAll(property, index, value.substring(cursor, macro.next()));
      }
      cursor = macro.next();
      found = cursor < value.length() ? MacroScanner.scan(value, cursor) : Optional.empty();
    }
    clones.appendAll(property, index, value.substring(cursor));
  }

  private List<String> literals(String argument) {
    String expanded = expander.expandWith(argument, ExpandMacroFunction.NESTED_SEPARATOR);
    return RangeAwareSplitter.splitTrimmed(expanded);
  }

  private static boolean containsDuplicate(String value) {
    int cursor = 0;
    while (cursor < value.length()) {
      Optional<Macro> found = MacroScanner.scan(value, cursor);
      if (found.isEmpty()) {
        return false;
      }
      if (found.get().isFunction(MACRO_NAME)) {
        return true;
      }
      cursor = found.get().next();
    }
    return false;
  }
}
