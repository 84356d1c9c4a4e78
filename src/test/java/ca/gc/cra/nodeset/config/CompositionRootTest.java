package ca.gc.cra.nodeset.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.nodeset.application.port.MetricsPort;
import ca.gc.cra.nodeset.domain.record.ConfigRecord;
import ca.gc.cra.nodeset.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.nodeset.infrastructure.range.BracketNodeRangeExpander;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void defaultsSelectNoOpMetrics() {
    CompositionRoot root = new CompositionRoot(ExpanderConfig.defaults());

    assertInstanceOf(NoOpMetricsAdapter.class, root.metrics());
  }

  @Test
  void rangeExpanderHonoursConfiguredCeiling() {
    CompositionRoot root = new CompositionRoot(ExpanderConfig.fromMap(Map.of("maxRangeSize", "7")));

    BracketNodeRangeExpander expander = assertInstanceOf(BracketNodeRangeExpander.class, root.rangeExpander());
    assertEquals(7, expander.maxRangeSize());
  }

  @Test
  void pipelineUsesConfiguredSeparator() {
    CompositionRoot root = new CompositionRoot(
        ExpanderConfig.fromMap(Map.of("separator", ";")), MetricsPort.NO_OP);

    List<ConfigRecord> out = root.pipeline().process(
        ConfigRecord.builder().add("members", "$EXPAND(n[1-3])$").build());

    assertEquals("n1;n2;n3", out.get(0).value("members", 0));
    assertSame(MetricsPort.NO_OP, root.metrics());
  }
}
