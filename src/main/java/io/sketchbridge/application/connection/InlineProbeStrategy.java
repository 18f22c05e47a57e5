package io.sketchbridge.application.connection;

import io.sketchbridge.domain.cad.Backend;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every probe sequentially on the dispatching thread.
 *
 * <p>A cycle blocks its caller for up to the sum of all backends' probe timeouts.</p>
 *
 * @since 0.1.0
 */
public final class InlineProbeStrategy implements ProbeStrategy {
  private static final Logger log = LoggerFactory.getLogger(InlineProbeStrategy.class);

  @Override
  public ProbeRound dispatch(Map<Backend, Callable<ProbeResult>> probes) {
    Map<Backend, ProbeResult> results = new EnumMap<>(Backend.class);
    for (Map.Entry<Backend, Callable<ProbeResult>> entry : probes.entrySet()) {
      results.put(entry.getKey(), runQuietly(entry.getKey(), entry.getValue()));
    }
    return ProbeRound.completed(results);
  }

  @Override
  public void shutdown() {
    // nothing to release
  }

  @Override
  public String name() {
    return "inline";
  }

  private static ProbeResult runQuietly(Backend backend, Callable<ProbeResult> probe) {
    try {
      ProbeResult result = probe.call();
      return result == null ? ProbeResult.DISCONNECTED : result;
    } catch (Exception ex) {
      log.warn("Probe task for {} escaped its own error handling", backend.displayName(), ex);
      return ProbeResult.DISCONNECTED;
    }
  }
}
