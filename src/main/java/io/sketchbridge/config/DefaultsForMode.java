package io.sketchbridge.config;

import io.sketchbridge.domain.cad.Backend;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default settings for each SketchBridge CLI command.
 *
 * <p>The defaults are the single source of truth for every optional YAML key.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults of a command merged over the common defaults.
   *
   * @param command CLI command ({@code status}, {@code monitor} or {@code transfer})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for unknown commands
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (command.trim().toLowerCase(Locale.ROOT)) {
      case "status" -> Map.of("backends", "all");
      case "monitor" -> Map.of("durationSeconds", "0");
      case "transfer" -> Map.of(
          "dx", "0", "dy", "0", "angle", "0", "pivot", "centroid", "strip", "false", "plane", "XY");
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    BridgeConfig defaults = BridgeConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("probe.intervalMillis", Long.toString(defaults.probeInterval().toMillis()));
    map.put("probe.timeoutMillis", Long.toString(defaults.probeTimeout().toMillis()));
    map.put("probe.collectPollMillis", Long.toString(defaults.collectPollInterval().toMillis()));
    map.put("probe.strategy", defaults.probeMode().name().toLowerCase(Locale.ROOT));
    map.put("probe.workers", Integer.toString(defaults.probeWorkers()));
    map.put("probe.livenessPolicy", "trust-cached");
    map.put("connect.timeoutMillis", Long.toString(defaults.connectTimeout().toMillis()));
    for (Backend backend : Backend.all()) {
      map.put("backends." + backend.configKey() + ".host", backend.defaultEndpoint().host());
      map.put("backends." + backend.configKey() + ".port", Integer.toString(backend.defaultPort()));
    }
    return Map.copyOf(map);
  }
}
