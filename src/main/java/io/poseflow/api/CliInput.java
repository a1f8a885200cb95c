package io.poseflow.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into flags ({@code --verbose}) and {@code key=value} pairs.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] keyValueArgs;
  private final Set<String> flags;

  private CliInput(String[] keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Parses raw arguments. Help and verbose aliases are normalized to {@code --help} and
   * {@code --verbose}; other dash-prefixed tokens without {@code '='} are kept as lower-case flags.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of());
    }
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags));
  }

  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --sequential} was supplied.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
