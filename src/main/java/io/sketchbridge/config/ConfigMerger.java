package io.sketchbridge.config;

import io.sketchbridge.domain.cad.Backend;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map.
   *
   * @param command active CLI command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked for suspicious combinations and for CLI keys overriding YAML keys
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Consumer<String> warnings = warn == null ? message -> { } : warn;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key)) {
        warnings.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(merged, warnings);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective, Consumer<String> warn) {
    long interval = parseLong(effective, "probe.intervalMillis");
    long timeout = parseLong(effective, "probe.timeoutMillis");
    if (interval > 0 && timeout >= interval) {
      warn.accept("probe.timeoutMillis (" + timeout + ") is not below probe.intervalMillis (" + interval
          + "); slow backends will cause skipped probe cycles");
    }
    long inlineWorstCase = timeout * Backend.all().size();
    if ("inline".equalsIgnoreCase(trim(effective.get("probe.strategy")))
        && interval > 0 && inlineWorstCase >= interval) {
      warn.accept("probe.strategy=inline can block the control thread for up to " + inlineWorstCase
          + " ms per tick");
    }
  }

  private static long parseLong(Map<String, String> effective, String key) {
    String raw = trim(effective.get(key));
    if (raw.isEmpty()) {
      return -1L;
    }
    try {
      return Long.parseLong(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be numeric (was " + raw + ")", ex);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
