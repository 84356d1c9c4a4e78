package ca.gc.cra.nodeset.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"in=a.yaml", "--Dry-Run", "-v", "out=b.yaml"});

    assertArrayEquals(new String[] {"in=a.yaml", "out=b.yaml"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void aliasesResolveToCanonicalSwitches() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"HELP"}).help());
    assertTrue(CliInput.parse(new String[] {"--debug"}).verbose());
    assertTrue(CliInput.parse(new String[] {"-h"}).hasFlag(CliInput.HELP));
  }

  @Test
  void nullArgsAreEmpty() {
    CliInput input = CliInput.parse(null);

    assertArrayEquals(new String[0], input.keyValueArgs());
    assertFalse(input.hasFlag("--dry-run"));
  }

  @Test
  void unknownSwitchIsRejected() {
    CliInput input = CliInput.parse(new String[] {"--dry-run", "--force"});

    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> input.requireKnownFlags(Set.of("--dry-run")));
    assertTrue(ex.getMessage().contains("--force"));
  }

  @Test
  void helpAndVerboseAreAlwaysKnown() {
    CliInput input = CliInput.parse(new String[] {"-v", "-h"});

    assertDoesNotThrow(() -> input.requireKnownFlags(Set.of()));
  }
}
