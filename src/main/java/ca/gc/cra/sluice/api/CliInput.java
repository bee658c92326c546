package ca.gc.cra.sluice.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Splits raw CLI arguments into positional words, {@code key=value} settings and {@code --flags}.
 *
 * <p>Help ({@code --help}, {@code -h}, {@code help}) and verbose ({@code --verbose}, {@code -v}, {@code --debug})
 * aliases are normalized to their long form. Positional words are any argument without {@code =} that does not start
 * with a dash.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_ALIASES = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_ALIASES = Set.of("--verbose", "-v", "--debug");

  private final List<String> positional;
  private final List<String> settings;
  private final Set<String> flags;

  private CliInput(List<String> positional, List<String> settings, Set<String> flags) {
    this.positional = List.copyOf(positional);
    this.settings = List.copyOf(settings);
    this.flags = Set.copyOf(flags);
  }

  public static CliInput parse(String[] args) {
    List<String> positional = new ArrayList<>();
    List<String> settings = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_ALIASES.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_ALIASES.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.contains("=")) {
          settings.add(arg);
        } else if (arg.startsWith("-")) {
          flags.add(lower);
        } else {
          positional.add(arg);
        }
      }
    }
    return new CliInput(positional, settings, flags);
  }

  public List<String> positional() {
    return positional;
  }

  /** {@code key=value} settings parsed and validated by {@link CliArgsParser}. */
  public Map<String, String> settings() {
    return CliArgsParser.toMap(settings);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /** Returns a copy of this input with the first positional word removed. */
  public CliInput shift() {
    List<String> rest = positional.isEmpty() ? positional : positional.subList(1, positional.size());
    return new CliInput(rest, settings, flags);
  }
}
