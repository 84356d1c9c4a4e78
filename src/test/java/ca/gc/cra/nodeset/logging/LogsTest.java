package ca.gc.cra.nodeset.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("h0,h1", Logs.truncate("h0,h1", 16));
  }

  @Test
  void longValuesAreCutWithLengthMetadata() {
    String truncated = Logs.truncate("abcdefghij", 4);

    assertTrue(truncated.startsWith("abcd..."));
    assertTrue(truncated.endsWith("(truncated, 4 of 10)"));
  }

  @Test
  void nullRendersPlaceholder() {
    assertEquals("<null>", Logs.truncate(null, 4));
  }

  @Test
  void nonPositiveLimitIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }
}
