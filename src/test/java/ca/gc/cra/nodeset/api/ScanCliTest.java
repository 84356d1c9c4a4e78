package ca.gc.cra.nodeset.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScanCliTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsEachMacroInOrder() {
    ExitCode code = ScanCli.run(new String[] {"text=web$EXPAND(n[1-3])$ $HOST"});

    assertEquals(ExitCode.SUCCESS, code);
    String[] lines = buffer.toString().split("\\R");
    assertEquals("name=EXPAND span=3..18 argument='n[1-3]' closedWithDollar=true", lines[0]);
    assertEquals("name=HOST span=20..24 argument=<none> closedWithDollar=false", lines[1]);
  }

  @Test
  void reportsWhenNothingFound() {
    assertEquals(ExitCode.SUCCESS, ScanCli.run(new String[] {"text=plain"}));
    assertTrue(buffer.toString().contains("No macros found."));
  }

  @Test
  void malformedMacroReturnsConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, ScanCli.run(new String[] {"text=$EXPAND(h[0-2"}));
  }

  @Test
  void unknownOptionReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, ScanCli.run(new String[] {"text=$HOST", "--dry-run"}));
  }

  @Test
  void missingTextReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, ScanCli.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: scan"));
  }
}
