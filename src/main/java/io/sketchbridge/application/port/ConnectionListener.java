package io.sketchbridge.application.port;

import io.sketchbridge.domain.cad.Backend;
import java.util.Map;

/**
 * <strong>What:</strong> Outbound port receiving connection notifications from the connection manager.
 * <p><strong>Why:</strong> Lets status displays and loggers follow backend availability without polling.</p>
 * <p><strong>Delivery:</strong> Probe-driven notifications arrive on the manager's control thread; manual
 * connect/disconnect notifications arrive on the caller's thread. Exceptions thrown by a listener are logged
 * and dropped.</p>
 * <p><strong>Ordering:</strong> For one backend, probe-driven {@link #connectivityChanged} calls alternate between
 * {@code true} and {@code false}. Manual notifications from another thread may interleave with them. Listeners run
 * without any manager lock held, so a slow listener delays only the thread that calls it.</p>
 *
 * @since 0.1.0
 */
public interface ConnectionListener {

  /**
   * Backend connectivity changed (probe) or was set explicitly (manual connect/disconnect).
   *
   * @param backend affected backend
   * @param connected new connectivity
   */
  default void connectivityChanged(Backend backend, boolean connected) {}

  /**
   * A connected backend reported a non-empty status.
   *
   * @param backend affected backend
   * @param status immutable status snapshot
   */
  default void statusUpdated(Backend backend, Map<String, Object> status) {}

  /** Listener that ignores every notification. */
  ConnectionListener NO_OP = new ConnectionListener() {};
}
