package io.sketchbridge.application.connection;

import java.util.Locale;

/**
 * How a probe decides whether a backend it already believes connected is still alive.
 *
 * <p>Under {@link #TRUST_CACHED} a backend that went away keeps being reported as connected for as long as its
 * status call keeps succeeding (for instance when the adapter answers from a local cache). The window closes at
 * the first failing probe status call or the first failing user operation that leads to a reconnect.
 * {@link #REVALIDATE} narrows it by asking the adapter about its session on every tick and reconnecting when the
 * adapter reports the session gone.</p>
 *
 * @since 0.1.0
 */
public enum LivenessPolicy {
  /** Backends marked connected are only asked for status; no connect attempt is made. */
  TRUST_CACHED,
  /** Every tick consults the adapter's session state and reconnects with the probe timeout if it is closed. */
  REVALIDATE;

  /**
   * Parses a configuration value such as {@code trust-cached} or {@code revalidate}.
   *
   * @param raw configuration text
   * @return matching policy
   * @throws IllegalArgumentException when the value is not recognised
   */
  public static LivenessPolicy parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return TRUST_CACHED;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "probe.livenessPolicy must be trust-cached or revalidate (was " + raw + ")", ex);
    }
  }
}
