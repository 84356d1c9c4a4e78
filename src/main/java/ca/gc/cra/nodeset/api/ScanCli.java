package ca.gc.cra.nodeset.api;

import ca.gc.cra.nodeset.domain.macro.Macro;
import ca.gc.cra.nodeset.domain.macro.MacroScanner;
import ca.gc.cra.nodeset.domain.macro.MacroSyntaxException;
import ca.gc.cra.nodeset.logging.LoggingConfigurator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints every macro found in one value, left to right, for troubleshooting.
 *
 * <p>Each macro is reported with its name, inclusive span, argument text, and whether a second
 * {@code $} closed it.</p>
 *
 * @since 0.1.0
 */
public final class ScanCli {
  private static final Logger log = LoggerFactory.getLogger(ScanCli.class);
  private static final String SUMMARY_USAGE = "usage: scan text=VALUE";
  private static final String HELP_TEXT = """
      Nodeset macro scanner

      Usage:
        scan text='web$EXPAND(n[1-3])$.example'

      Required:
        text=VALUE   Value to scan for $-prefixed macros

      Flags:
        --verbose    Enable DEBUG logging
        --help       Show this message
      """;

  private ScanCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String text;
    try {
      input.requireKnownFlags(Set.of());
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      text = kv.get("text");
      if (text == null) {
        throw new IllegalArgumentException("text is required");
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    int found = 0;
    try {
      int cursor = 0;
      Optional<Macro> next = MacroScanner.scan(text, cursor);
      while (next.isPresent()) {
        Macro macro = next.get();
        CliPrinter.println(describe(macro));
        found++;
        cursor = macro.next();
        next = MacroScanner.scan(text, cursor);
      }
    } catch (MacroSyntaxException ex) {
      log.error("Macro syntax error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    if (found == 0) {
      CliPrinter.println("No macros found.");
    }
    return ExitCode.SUCCESS;
  }

  static String describe(Macro macro) {
    return "name=" + macro.name()
        + " span=" + macro.start() + ".." + macro.end()
        + " argument=" + macro.arguments().map(arg -> "'" + arg.text() + "'").orElse("<none>")
        + " closedWithDollar=" + macro.closedWithDollar();
  }
}
