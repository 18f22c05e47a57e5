package io.sketchbridge.config;

import io.sketchbridge.application.connection.ConnectionManager;
import io.sketchbridge.application.connection.InlineProbeStrategy;
import io.sketchbridge.application.connection.PooledProbeStrategy;
import io.sketchbridge.application.connection.ProbeStrategy;
import io.sketchbridge.application.port.CadClientPort;
import io.sketchbridge.application.port.MetricsPort;
import io.sketchbridge.application.transfer.TransferUseCase;
import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.infrastructure.client.CadClients;
import io.sketchbridge.infrastructure.events.LoggingConnectionListener;
import io.sketchbridge.infrastructure.metrics.NoOpMetricsAdapter;
import io.sketchbridge.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Wires the connection manager and transfer use case to concrete adapters.
 * <p><strong>Role:</strong> Adapter composition root used by the CLI commands.</p>
 * <p><strong>Thread-safety:</strong> Not synchronized; build the object graph during startup on one thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final BridgeConfig config;
  private final MetricsPort metrics;
  private final Supplier<Map<Backend, CadClientPort>> clients;

  /**
   * Creates a root that discovers adapters through {@link java.util.ServiceLoader}.
   *
   * @param config validated configuration
   * @param metrics metrics adapter shared by every component
   */
  public CompositionRoot(BridgeConfig config, MetricsPort metrics) {
    this(config, metrics, () -> CadClients.discover(config.endpoints()));
  }

  /**
   * Creates a root over an explicit adapter table.
   *
   * @param config validated configuration
   * @param metrics metrics adapter shared by every component
   * @param clients supplies one adapter per backend
   */
  public CompositionRoot(
      BridgeConfig config, MetricsPort metrics, Supplier<Map<Backend, CadClientPort>> clients) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clients = Objects.requireNonNull(clients, "clients");
  }

  /**
   * Picks the metrics adapter for an exporter name.
   *
   * @param exporter {@code otlp} or {@code none}
   * @return OpenTelemetry adapter, or a no-op adapter for {@code none}
   */
  public static MetricsPort metricsFor(String exporter) {
    if (exporter != null && "none".equals(exporter.trim().toLowerCase(Locale.ROOT))) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter();
  }

  public BridgeConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the configured probe strategy.
   *
   * @return new strategy; owned by whichever manager receives it
   */
  public ProbeStrategy probeStrategy() {
    return switch (config.probeMode()) {
      case POOLED -> new PooledProbeStrategy(config.probeWorkers());
      case INLINE -> new InlineProbeStrategy();
    };
  }

  /**
   * Builds a connection manager with a logging listener attached. The manager is not started.
   *
   * @return new connection manager
   */
  public ConnectionManager connectionManager() {
    ConnectionManager manager =
        new ConnectionManager(clients.get(), probeStrategy(), config.probeSettings(), metrics);
    manager.addListener(new LoggingConnectionListener(metrics));
    return manager;
  }

  /**
   * Builds a transfer use case over an existing manager.
   *
   * @param manager connection manager to route backend calls through
   * @return new transfer use case
   */
  public TransferUseCase transferUseCase(ConnectionManager manager) {
    return new TransferUseCase(manager, metrics);
  }
}
