package ca.gc.cra.nodeset.application.expand;

import ca.gc.cra.nodeset.application.port.MetricsPort;
import ca.gc.cra.nodeset.domain.macro.MacroSyntaxException;
import ca.gc.cra.nodeset.domain.record.ConfigRecord;
import ca.gc.cra.nodeset.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Orchestrates duplication, EXPAND rewriting, and blank-value pruning for records.
 * <p><strong>Why:</strong> Configuration loaders need one call that turns a templated record into the final set.</p>
 * <p><strong>Role:</strong> Application entry point invoked by the CLI and by embedding loaders.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run {@link ObjectDuplicator} to obtain the clone list.</li>
 *   <li>Run the EXPAND pass over every value of every clone, in place.</li>
 *   <li>Drop values that end up empty or whitespace only; emptied properties stay present.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; concurrent calls on different records are safe.</p>
 * <p><strong>Performance:</strong> Linear in the size of the produced clones.</p>
 * <p><strong>Observability:</strong> Emits {@code expand.records.in}, {@code expand.records.out},
 * {@code expand.syntax.errors}, and {@code expand.clones.per.record}; logs syntax failures at WARN.</p>
 *
 * @implNote A syntax error anywhere aborts the whole call; no partially expanded records are returned.
 * @since 0.1.0
 */
public final class ExpansionPipeline {
  private static final Logger log = LoggerFactory.getLogger(ExpansionPipeline.class);
  private static final int LOG_VALUE_BYTES = 256;

  private final ExpandMacroFunction expander;
  private final ObjectDuplicator duplicator;
  private final MetricsPort metrics;

  /**
   * Creates a pipeline without metrics.
   *
   * @param expander EXPAND pass; must not be {@code null}
   */
  public ExpansionPipeline(ExpandMacroFunction expander) {
    this(expander, MetricsPort.NO_OP);
  }

  /**
   * Creates a pipeline reporting to {@code metrics}.
   *
   * @param expander EXPAND pass; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public ExpansionPipeline(ExpandMacroFunction expander, MetricsPort metrics) {
    this.expander = Objects.requireNonNull(expander, "expander");
    this.duplicator = new ObjectDuplicator(expander);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Expands one record.
   *
   * @param record source record; never mutated
   * @return expanded, duplicated, pruned records; at least one
   * @throws MacroSyntaxException if any value holds a malformed macro or range
   */
  public List<ConfigRecord> process(ConfigRecord record) {
    Objects.requireNonNull(record, "record");
    metrics.increment("expand.records.in");

    List<ConfigRecord> clones;
    try {
      clones = duplicator.duplicate(record);
    } catch (MacroSyntaxException ex) {
      metrics.increment("expand.syntax.errors");
      log.warn("DUPLICATE failed ({}): {}", ex.error(), Logs.truncate(ex.offendingText(), LOG_VALUE_BYTES));
      throw ex;
    }

    for (ConfigRecord clone : clones) {
      expandInPlace(clone);
    }

    metrics.observe("expand.clones.per.record", clones.size());
    for (int i = 0; i < clones.size(); i++) {
      metrics.increment("expand.records.out");
    }
    log.debug("Expanded record with {} properties into {} record(s)", record.size(), clones.size());
    return clones;
  }

  /**
   * Expands several records, concatenating the results in input order.
   *
   * @param records source records; never mutated
   * @return all produced records
   * @throws MacroSyntaxException if any record fails
   */
  public List<ConfigRecord> processAll(List<ConfigRecord> records) {
    Objects.requireNonNull(records, "records");
    List<ConfigRecord> out = new ArrayList<>();
    for (ConfigRecord record : records) {
      out.addAll(process(record));
    }
    return out;
  }

  private void expandInPlace(ConfigRecord clone) {
    for (String property : clone.propertyNames()) {
      List<String> values = clone.values(property);
      for (int i = 0; i < values.size(); i++) {
        String raw = values.get(i);
        try {
          clone.setValue(property, i, expander.expand(raw));
        } catch (MacroSyntaxException ex) {
          metrics.increment("expand.syntax.errors");
          log.warn("EXPAND failed for property {} ({}): {}",
              property, ex.error(), Logs.truncate(raw, LOG_VALUE_BYTES));
          throw ex;
        }
      }
    }
    int removed = clone.removeBlankValues();
    if (removed > 0) {
      log.debug("Dropped {} blank value(s) after expansion", removed);
    }
  }
}
