package io.sketchbridge.config;

import java.util.Locale;

/**
 * Selects the {@link io.sketchbridge.application.connection.ProbeStrategy} built by {@link CompositionRoot}.
 *
 * @since 0.1.0
 */
public enum ProbeMode {
  /** Probes run on a worker pool; ticks never block the control thread. */
  POOLED,
  /** Probes run one after another on the control thread. */
  INLINE;

  /**
   * Parses a configuration value, ignoring case.
   *
   * @param raw value such as {@code pooled}; blank yields {@link #POOLED}
   * @return matching mode
   * @throws IllegalArgumentException when the value is not recognised
   */
  public static ProbeMode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return POOLED;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "pooled" -> POOLED;
      case "inline" -> INLINE;
      default -> throw new IllegalArgumentException("probe.strategy must be pooled or inline (was " + raw + ")");
    };
  }
}
