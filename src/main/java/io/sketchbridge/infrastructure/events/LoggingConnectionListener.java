package io.sketchbridge.infrastructure.events;

import io.sketchbridge.application.port.ConnectionListener;
import io.sketchbridge.application.port.MetricsPort;
import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.logging.Logs;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes connection notifications to the log and counts them.
 *
 * <p>Connectivity changes log at INFO; status refreshes, which arrive on every probe of a connected backend, log
 * at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class LoggingConnectionListener implements ConnectionListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingConnectionListener.class);

  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates a listener.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted counters (e.g., {@code connection.events})
   */
  public LoggingConnectionListener(MetricsPort metrics, String metricPrefix) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix =
        metricPrefix == null || metricPrefix.isBlank() ? "connection.events" : metricPrefix.trim();
  }

  public LoggingConnectionListener(MetricsPort metrics) {
    this(metrics, "connection.events");
  }

  public LoggingConnectionListener() {
    this(MetricsPort.NO_OP);
  }

  @Override
  public void connectivityChanged(Backend backend, boolean connected) {
    Objects.requireNonNull(backend, "backend");
    metrics.increment(metricPrefix + (connected ? ".connected" : ".disconnected"));
    log.info("connection.event backend={} connected={}", backend.configKey(), connected);
  }

  @Override
  public void statusUpdated(Backend backend, Map<String, Object> status) {
    Objects.requireNonNull(backend, "backend");
    metrics.increment(metricPrefix + ".status");
    if (log.isDebugEnabled()) {
      log.debug("connection.status backend={} status={}", backend.configKey(), Logs.summarize(status));
    }
  }
}
