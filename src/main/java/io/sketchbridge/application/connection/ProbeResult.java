package io.sketchbridge.application.connection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of probing one backend.
 *
 * @param connected whether the backend is reachable
 * @param status status snapshot; always empty when {@code connected} is {@code false}
 * @since 0.1.0
 */
public record ProbeResult(boolean connected, Map<String, Object> status) {

  /** Unreachable backend. */
  public static final ProbeResult DISCONNECTED = new ProbeResult(false, Map.of());

  public ProbeResult {
    status = connected && status != null && !status.isEmpty()
        ? Collections.unmodifiableMap(new LinkedHashMap<>(status))
        : Map.of();
  }

  /**
   * Reachable backend with the status it reported.
   *
   * @param status reported status; {@code null} is treated as empty
   * @return result
   */
  public static ProbeResult connected(Map<String, Object> status) {
    return new ProbeResult(true, status);
  }
}
