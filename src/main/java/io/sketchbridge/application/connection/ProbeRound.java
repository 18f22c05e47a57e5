package io.sketchbridge.application.connection;

import io.sketchbridge.domain.cad.Backend;
import java.util.EnumMap;
import java.util.Map;

/**
 * Handle on one dispatched probe cycle, polled by the control thread until every result has been drained.
 *
 * @since 0.1.0
 */
public interface ProbeRound {

  /**
   * Removes and returns results that finished since the previous call. Never blocks.
   *
   * @return newly finished results keyed by backend; empty when none finished
   */
  Map<Backend, ProbeResult> drainCompleted();

  /**
   * Indicates that every dispatched probe has finished and its result has been drained.
   *
   * @return {@code true} once nothing is left to collect
   */
  boolean isComplete();

  /**
   * Round whose results are all available up front.
   *
   * @param results results keyed by backend
   * @return round completing on its first drain
   */
  static ProbeRound completed(Map<Backend, ProbeResult> results) {
    return new ProbeRound() {
      private Map<Backend, ProbeResult> remaining = results.isEmpty() ? Map.of() : new EnumMap<>(results);

      @Override
      public synchronized Map<Backend, ProbeResult> drainCompleted() {
        Map<Backend, ProbeResult> drained = remaining;
        remaining = Map.of();
        return drained;
      }

      @Override
      public synchronized boolean isComplete() {
        return remaining.isEmpty();
      }
    };
  }
}
