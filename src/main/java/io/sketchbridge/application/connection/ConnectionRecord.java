package io.sketchbridge.application.connection;

import java.util.Map;

/**
 * Cached connectivity and status of one backend.
 *
 * <p>The record's monitor serializes every write, and {@link #update} hands back the previous connectivity in the
 * same critical section so callers can detect an edge. Listeners are notified after the monitor is released.</p>
 */
final class ConnectionRecord {
  private boolean connected;
  private Map<String, Object> status = Map.of();

  synchronized boolean connected() {
    return connected;
  }

  synchronized Map<String, Object> status() {
    return status;
  }

  /**
   * Stores a new observation.
   *
   * @param result observation; its status is empty whenever it is disconnected
   * @return connectivity before the update
   */
  synchronized boolean update(ProbeResult result) {
    boolean previous = connected;
    connected = result.connected();
    status = result.status();
    return previous;
  }
}
