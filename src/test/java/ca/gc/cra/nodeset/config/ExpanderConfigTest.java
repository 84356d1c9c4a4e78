package ca.gc.cra.nodeset.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ExpanderConfigTest {

  @Test
  void defaultsUseCommaYamlAndNoMetrics() {
    ExpanderConfig config = ExpanderConfig.defaults();

    assertEquals(",", config.separator());
    assertEquals(100_000, config.maxRangeSize());
    assertEquals(OutputFormat.YAML, config.outputFormat());
    assertEquals("none", config.metricsExporter());
    assertTrue(config.input().isEmpty());
  }

  @Test
  void fromMapParsesAllKeys() {
    ExpanderConfig config = ExpanderConfig.fromMap(Map.of(
        "in", "hosts.yaml",
        "out", "out.ndjson",
        "separator", " ",
        "maxRangeSize", "50",
        "format", "NDJSON",
        "metricsExporter", "OTLP",
        "otelEndpoint", " http://collector:4317 "));

    assertEquals(Optional.of(Path.of("hosts.yaml")), config.input());
    assertEquals(Optional.of(Path.of("out.ndjson")), config.output());
    assertEquals(" ", config.separator());
    assertEquals(50, config.maxRangeSize());
    assertEquals(OutputFormat.NDJSON, config.outputFormat());
    assertEquals("otlp", config.metricsExporter());
    assertEquals("http://collector:4317", config.otelEndpoint());
  }

  @Test
  void fromMapFallsBackToDefaults() {
    assertEquals(ExpanderConfig.defaults(), ExpanderConfig.fromMap(Map.of()));
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> ExpanderConfig.fromMap(Map.of("maxRangeSize", "0")));
    assertThrows(IllegalArgumentException.class, () -> ExpanderConfig.fromMap(Map.of("format", "xml")));
    assertThrows(IllegalArgumentException.class,
        () -> ExpanderConfig.fromMap(Map.of("metricsExporter", "prometheus")));
    assertThrows(IllegalArgumentException.class, () -> ExpanderConfig.fromMap(Map.of("separator", "\n")));
  }
}
