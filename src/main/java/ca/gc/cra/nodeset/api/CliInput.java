package ca.gc.cra.nodeset.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command-line tokens split into switches ({@code --dry-run}) and {@code key=value} arguments.
 */
final class CliInput {
  static final String HELP = "--help";
  static final String VERBOSE = "--verbose";

  private static final Map<String, String> ALIASES = Map.of(
      "-h", HELP,
      "help", HELP,
      "-v", VERBOSE,
      "--debug", VERBOSE);

  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Splits raw arguments. A token that starts with {@code -} and has no {@code '='} is a switch,
   * lower-cased and with its aliases resolved; {@code help} is accepted as well. Everything else is kept
   * in command-line order. Blank and {@code null} tokens are dropped.
   */
  static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (ALIASES.containsKey(lower)) {
          flags.add(ALIASES.get(lower));
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(List.copyOf(kv), Set.copyOf(flags));
  }

  String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  boolean help() {
    return flags.contains(HELP);
  }

  boolean verbose() {
    return flags.contains(VERBOSE);
  }

  boolean hasFlag(String flag) {
    return flags.contains(flag);
  }

  /**
   * Rejects any switch outside {@code allowed}; {@code --help} and {@code --verbose} are always allowed.
   *
   * @throws IllegalArgumentException naming the first unrecognised switch
   */
  void requireKnownFlags(Set<String> allowed) {
    for (String flag : flags) {
      if (!flag.equals(HELP) && !flag.equals(VERBOSE) && !allowed.contains(flag)) {
        throw new IllegalArgumentException("Unknown option: " + flag);
      }
    }
  }
}
