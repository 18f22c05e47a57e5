package io.sketchbridge.application.connection;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing and liveness tuning for the probe loop.
 *
 * @param interval delay between probe cycles
 * @param probeTimeout timeout handed to the adapter's connect call during a probe
 * @param collectPollInterval delay between result-collection passes on the control thread
 * @param livenessPolicy how already-connected backends are re-checked
 * @since 0.1.0
 */
public record ProbeSettings(
    Duration interval, Duration probeTimeout, Duration collectPollInterval, LivenessPolicy livenessPolicy) {

  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);
  public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(1);
  public static final Duration DEFAULT_COLLECT_POLL = Duration.ofMillis(100);

  /**
   * Validates durations and defaults the liveness policy.
   *
   * @throws IllegalArgumentException if any duration is zero or negative
   */
  public ProbeSettings {
    interval = requirePositive("interval", interval);
    probeTimeout = requirePositive("probeTimeout", probeTimeout);
    collectPollInterval = requirePositive("collectPollInterval", collectPollInterval);
    livenessPolicy = Objects.requireNonNullElse(livenessPolicy, LivenessPolicy.TRUST_CACHED);
  }

  /**
   * Five second ticks, one second probe timeout, 100 ms collection, cached liveness.
   *
   * @return default settings
   */
  public static ProbeSettings defaults() {
    return new ProbeSettings(
        DEFAULT_INTERVAL, DEFAULT_PROBE_TIMEOUT, DEFAULT_COLLECT_POLL, LivenessPolicy.TRUST_CACHED);
  }

  private static Duration requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive (was " + value + ")");
    }
    return value;
  }
}
