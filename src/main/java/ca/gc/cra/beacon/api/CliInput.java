package ca.gc.cra.beacon.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * One command's arguments: {@code key=value} settings plus the switches BEACON commands understand.
 *
 * <p>Anything starting with {@code -} that is not a known switch is kept as an unrecognized flag so the command can
 * report it instead of treating it as a setting.</p>
 */
public final class CliInput {

  /**
   * Switches shared by every command.
   */
  public enum Switch {
    HELP("--help", "-h", "help"),
    VERBOSE("--verbose", "-v", "--debug"),
    DRY_RUN("--dry-run");

    private final List<String> aliases;

    Switch(String... aliases) {
      this.aliases = List.of(aliases);
    }

    /**
     * Canonical spelling, e.g. {@code --dry-run}.
     *
     * @return first alias
     */
    public String flag() {
      return aliases.get(0);
    }

    static Optional<Switch> lookup(String token) {
      String lower = token.toLowerCase(Locale.ROOT);
      for (Switch candidate : values()) {
        if (candidate.aliases.contains(lower)) {
          return Optional.of(candidate);
        }
      }
      return Optional.empty();
    }
  }

  private static final CliInput EMPTY = new CliInput(List.of(), EnumSet.noneOf(Switch.class), Set.of());

  private final List<String> settings;
  private final Set<Switch> switches;
  private final Set<String> unrecognized;

  private CliInput(List<String> settings, Set<Switch> switches, Set<String> unrecognized) {
    this.settings = settings;
    this.switches = switches;
    this.unrecognized = unrecognized;
  }

  /**
   * Splits raw arguments. Blank and {@code null} entries are skipped.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return EMPTY;
    }
    List<String> settings = new ArrayList<>();
    Set<Switch> switches = EnumSet.noneOf(Switch.class);
    Set<String> unrecognized = new LinkedHashSet<>();
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      Optional<Switch> known = Switch.lookup(arg);
      if (known.isPresent()) {
        switches.add(known.get());
      } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
        unrecognized.add(arg.toLowerCase(Locale.ROOT));
      } else {
        settings.add(arg);
      }
    }
    return new CliInput(
        List.copyOf(settings),
        Collections.unmodifiableSet(switches),
        Collections.unmodifiableSet(unrecognized));
  }

  /**
   * Returns the {@code key=value} arguments in command-line order, ready for {@link CliArgsParser#toMap(String[])}.
   *
   * @return fresh array
   */
  public String[] settingArgs() {
    return settings.toArray(String[]::new);
  }

  public boolean has(Switch option) {
    return switches.contains(option);
  }

  public boolean help() {
    return has(Switch.HELP);
  }

  public boolean verbose() {
    return has(Switch.VERBOSE);
  }

  public boolean dryRun() {
    return has(Switch.DRY_RUN);
  }

  /**
   * Flags that matched no {@link Switch}, lowercased, in first-seen order.
   *
   * @return unmodifiable set; empty when every flag was recognized
   */
  public Set<String> unrecognizedFlags() {
    return unrecognized;
  }
}
