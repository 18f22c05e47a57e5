package io.sketchbridge.api;

import io.sketchbridge.validation.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Command arguments after one pass: bare flags such as {@code --require-all}, {@code key=value} options such as
 * {@code backends.fusion.port=9000}, and any argument that fit neither shape.
 *
 * <p>Parsing never throws. Commands print help first and then refuse to run when {@link #problems()} is not
 * empty, so {@code --help} works even next to a typo.</p>
 *
 * @param options options in argument order; a repeated key keeps the last value, an empty value is kept
 * @param flags lower-case flags with aliases folded ({@code -h} to {@code --help}, {@code -v} to {@code --verbose})
 * @param problems one message per rejected argument
 */
record CliInput(Map<String, String> options, Set<String> flags, List<String> problems) {
  static final String HELP = "--help";
  static final String VERBOSE = "--verbose";
  private static final Map<String, String> ALIASES = Map.of(
      "-h", HELP, "help", HELP, "-v", VERBOSE, "--debug", VERBOSE);
  private static final Pattern OPTION_KEY = Pattern.compile("[A-Za-z0-9._-]+");

  static CliInput parse(String[] args) {
    Map<String, String> options = new LinkedHashMap<>();
    Set<String> flags = new LinkedHashSet<>();
    List<String> problems = new ArrayList<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        int eq = arg.indexOf('=');
        if (eq < 0) {
          String flag = arg.toLowerCase(Locale.ROOT);
          flag = ALIASES.getOrDefault(flag, flag);
          if (flag.startsWith("-")) {
            flags.add(flag);
          } else {
            problems.add("expected key=value but got '" + arg + "'");
          }
          continue;
        }
        String key = arg.substring(0, eq).trim();
        String value = arg.substring(eq + 1).trim();
        if (!OPTION_KEY.matcher(key).matches()) {
          problems.add("invalid option name '" + key + "'");
          continue;
        }
        try {
          options.put(key, value.isEmpty() ? value : Strings.requireNonBlank(key, value));
        } catch (IllegalArgumentException ex) {
          problems.add(ex.getMessage());
        }
      }
    }
    return new CliInput(Collections.unmodifiableMap(options), Set.copyOf(flags), List.copyOf(problems));
  }

  boolean help() {
    return flags.contains(HELP);
  }

  boolean verbose() {
    return flags.contains(VERBOSE);
  }

  boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Mutable copy of the options for the merge step, which consumes telemetry and config keys.
   *
   * @return options in argument order
   */
  Map<String, String> optionsCopy() {
    return new LinkedHashMap<>(options);
  }
}
