package ca.gc.cra.nodeset.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void expandDefaultsIncludeCommonKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Expand ");

    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals(",", defaults.get("separator"));
    assertEquals("100000", defaults.get("maxRangeSize"));
    assertEquals("yaml", defaults.get("format"));
    assertEquals("false", defaults.get("dryRun"));
  }

  @Test
  void defaultsBuildValidConfig() {
    assertEquals(ExpanderConfig.defaults(), ExpanderConfig.fromMap(DefaultsForMode.asFlatMap("expand")));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
