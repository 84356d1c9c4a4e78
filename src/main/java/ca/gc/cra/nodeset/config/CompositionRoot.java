package ca.gc.cra.nodeset.config;

import ca.gc.cra.nodeset.application.expand.ExpandMacroFunction;
import ca.gc.cra.nodeset.application.expand.ExpansionPipeline;
import ca.gc.cra.nodeset.application.port.MetricsPort;
import ca.gc.cra.nodeset.application.port.NodeRangeExpander;
import ca.gc.cra.nodeset.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.nodeset.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.nodeset.infrastructure.range.BracketNodeRangeExpander;
import java.util.Objects;

/**
 * <strong>What:</strong> Composition root that wires the expansion pipeline to concrete adapters.
 * <p><strong>Why:</strong> Keeps adapter selection (range expander, metrics exporter) out of the CLI and the core.</p>
 * <p><strong>Role:</strong> Configuration layer invoked once per CLI run or by embedding loaders.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration; factory methods create new instances.</p>
 *
 * @since 0.1.0
 * @see ExpansionPipeline
 */
public final class CompositionRoot {
  private final ExpanderConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a composition root, selecting the metrics adapter from {@code config}.
   *
   * @param config validated settings; must not be {@code null}
   */
  public CompositionRoot(ExpanderConfig config) {
    this(config, metricsFor(config));
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param config validated settings; must not be {@code null}
   * @param metrics metrics adapter used by the pipeline; must not be {@code null}
   */
  public CompositionRoot(ExpanderConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public ExpanderConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the node-range adapter honouring {@link ExpanderConfig#maxRangeSize()}.
   *
   * @return new range expander
   */
  public NodeRangeExpander rangeExpander() {
    return new BracketNodeRangeExpander(config.maxRangeSize());
  }

  /**
   * Builds the EXPAND pass with the configured separator.
   *
   * @return new EXPAND pass
   */
  public ExpandMacroFunction expandMacroFunction() {
    return new ExpandMacroFunction(rangeExpander(), config.separator());
  }

  /**
   * Builds the full pipeline.
   *
   * @return new pipeline reporting to {@link #metrics()}
   */
  public ExpansionPipeline pipeline() {
    return new ExpansionPipeline(expandMacroFunction(), metrics);
  }

  private static MetricsPort metricsFor(ExpanderConfig config) {
    Objects.requireNonNull(config, "config");
    if ("none".equals(config.metricsExporter())) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(config.metricsExporter(), config.otelEndpoint());
  }
}
