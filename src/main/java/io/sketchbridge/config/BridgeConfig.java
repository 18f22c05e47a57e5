package io.sketchbridge.config;

import io.sketchbridge.application.connection.LivenessPolicy;
import io.sketchbridge.application.connection.ProbeSettings;
import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.domain.cad.Endpoint;
import io.sketchbridge.validation.Numbers;
import io.sketchbridge.validation.Strings;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed view of the flattened connection-monitoring settings.
 * <p><strong>Why:</strong> Keeps string parsing of CLI and YAML values in one place so the connection manager only
 * sees validated durations and endpoints.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param probeInterval delay between probe cycles ({@code probe.intervalMillis})
 * @param probeTimeout adapter connect timeout during probes ({@code probe.timeoutMillis})
 * @param collectPollInterval result-collection poll delay ({@code probe.collectPollMillis})
 * @param probeMode pooled or inline probing ({@code probe.strategy})
 * @param probeWorkers worker threads for pooled probing ({@code probe.workers})
 * @param livenessPolicy liveness check for connected backends ({@code probe.livenessPolicy})
 * @param connectTimeout timeout of manual connects ({@code connect.timeoutMillis})
 * @param endpoints RPC endpoint of every backend ({@code backends.<name>.host}, {@code backends.<name>.port})
 * @since 0.1.0
 */
public record BridgeConfig(
    Duration probeInterval,
    Duration probeTimeout,
    Duration collectPollInterval,
    ProbeMode probeMode,
    int probeWorkers,
    LivenessPolicy livenessPolicy,
    Duration connectTimeout,
    Map<Backend, Endpoint> endpoints) {

  private static final long MAX_MILLIS = Duration.ofHours(1).toMillis();
  private static final int MAX_WORKERS = 64;

  /**
   * Validates values and fills in any missing backend endpoint with its default.
   *
   * @throws IllegalArgumentException if a duration or worker count is out of range
   */
  public BridgeConfig {
    Objects.requireNonNull(probeInterval, "probeInterval");
    Objects.requireNonNull(probeTimeout, "probeTimeout");
    Objects.requireNonNull(collectPollInterval, "collectPollInterval");
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    probeMode = Objects.requireNonNullElse(probeMode, ProbeMode.POOLED);
    livenessPolicy = Objects.requireNonNullElse(livenessPolicy, LivenessPolicy.TRUST_CACHED);
    Numbers.requireRange("probe.workers", probeWorkers, 1, MAX_WORKERS);
    Map<Backend, Endpoint> complete = new EnumMap<>(Backend.class);
    for (Backend backend : Backend.all()) {
      Endpoint endpoint = endpoints == null ? null : endpoints.get(backend);
      complete.put(backend, endpoint == null ? backend.defaultEndpoint() : endpoint);
    }
    endpoints = Collections.unmodifiableMap(complete);
  }

  /**
   * Five second probe interval, one second probe timeout, four pooled workers, default endpoints.
   *
   * @return default configuration
   */
  public static BridgeConfig defaults() {
    ProbeSettings probe = ProbeSettings.defaults();
    return new BridgeConfig(
        probe.interval(),
        probe.probeTimeout(),
        probe.collectPollInterval(),
        ProbeMode.POOLED,
        4,
        probe.livenessPolicy(),
        Duration.ofSeconds(5),
        Map.of());
  }

  /**
   * Builds a configuration from flattened key/value pairs. Unknown keys are ignored.
   *
   * @param options merged CLI, YAML and default values
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static BridgeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    BridgeConfig defaults = defaults();

    Map<Backend, Endpoint> endpoints = new EnumMap<>(Backend.class);
    for (Backend backend : Backend.all()) {
      Endpoint fallback = backend.defaultEndpoint();
      String prefix = "backends." + backend.configKey() + '.';
      String host = Strings.blankToNull(options.get(prefix + "host"));
      String port = Strings.blankToNull(options.get(prefix + "port"));
      endpoints.put(backend, new Endpoint(
          host == null ? fallback.host() : host.trim(),
          port == null ? fallback.port() : (int) Numbers.parseInRange(prefix + "port", port, 1, 65535)));
    }

    return new BridgeConfig(
        millis(options, "probe.intervalMillis", defaults.probeInterval()),
        millis(options, "probe.timeoutMillis", defaults.probeTimeout()),
        millis(options, "probe.collectPollMillis", defaults.collectPollInterval()),
        ProbeMode.parse(options.get("probe.strategy")),
        integer(options, "probe.workers", defaults.probeWorkers(), 1, MAX_WORKERS),
        LivenessPolicy.parse(options.get("probe.livenessPolicy")),
        millis(options, "connect.timeoutMillis", defaults.connectTimeout()),
        endpoints);
  }

  /**
   * Probe timing for the connection manager.
   *
   * @return probe settings
   */
  public ProbeSettings probeSettings() {
    return new ProbeSettings(probeInterval, probeTimeout, collectPollInterval, livenessPolicy);
  }

  private static Duration millis(Map<String, String> options, String key, Duration fallback) {
    String raw = Strings.blankToNull(options.get(key));
    if (raw == null) {
      return fallback;
    }
    return Duration.ofMillis(Numbers.parseInRange(key, raw, 1, MAX_MILLIS));
  }

  private static int integer(Map<String, String> options, String key, int fallback, int min, int max) {
    String raw = Strings.blankToNull(options.get(key));
    return raw == null ? fallback : (int) Numbers.parseInRange(key, raw, min, max);
  }
}
