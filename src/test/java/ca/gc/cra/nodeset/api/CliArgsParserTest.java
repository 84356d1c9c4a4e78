package ca.gc.cra.nodeset.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"text=$EXPAND(a=b)$", " in = hosts.yaml "});

    assertEquals("$EXPAND(a=b)$", map.get("text"));
    assertEquals("hosts.yaml", map.get("in"));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMissingValueAndBadKeys() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=x"}));
  }

  @Test
  void rejectsControlCharactersInValues() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"separator=a\u0007b"}));
  }
}
