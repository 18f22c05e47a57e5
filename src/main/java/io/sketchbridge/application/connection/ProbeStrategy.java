package io.sketchbridge.application.connection;

import io.sketchbridge.domain.cad.Backend;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * <strong>What:</strong> Execution strategy for the blocking per-backend probe calls of one cycle.
 * <p><strong>Why:</strong> Probes block on network I/O. {@link PooledProbeStrategy} keeps the control thread free by
 * running them on a worker pool; {@link InlineProbeStrategy} runs them on the calling thread, trading
 * responsiveness for simplicity.</p>
 * <p><strong>Contract:</strong> Probe tasks never throw for backend failures; a task that throws anyway is reported
 * as {@link ProbeResult#DISCONNECTED}.</p>
 *
 * @since 0.1.0
 */
public interface ProbeStrategy {

  /**
   * Starts one probe per backend.
   *
   * @param probes probe tasks keyed by backend
   * @return handle polled for results
   */
  ProbeRound dispatch(Map<Backend, Callable<ProbeResult>> probes);

  /** Stops accepting work without waiting for, or interrupting, probes already running. */
  void shutdown();

  /**
   * Short label for logs.
   *
   * @return strategy name
   */
  String name();
}
