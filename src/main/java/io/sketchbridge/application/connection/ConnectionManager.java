package io.sketchbridge.application.connection;

import io.sketchbridge.application.port.CadClientPort;
import io.sketchbridge.application.port.ConnectionListener;
import io.sketchbridge.application.port.MetricsPort;
import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.domain.cad.PlaneInfo;
import io.sketchbridge.domain.cad.SketchInfo;
import io.sketchbridge.domain.sketch.SketchDocument;
import io.sketchbridge.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Keeps sessions to every CAD backend alive and publishes connectivity and status changes.
 *
 * <p>A single control thread ({@code sketchbridge-control}) ticks the probe loop. Each tick hands one probe per
 * backend to the configured {@link ProbeStrategy} and then polls for finished results, reconciling them into the
 * {@link ConnectionRegistry}. A tick that fires while the previous cycle is still collecting is skipped without
 * touching any adapter.</p>
 *
 * <p>{@link ConnectionListener#connectivityChanged} is edge-triggered for probe results and unconditional for
 * manual {@link #connect} and {@link #disconnect}. {@link ConnectionListener#statusUpdated} fires for every
 * connected observation that carries a non-empty status.</p>
 *
 * <p>No adapter exception escapes this class: failed connects leave the backend disconnected with an empty status
 * and failed operations return empty results.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  /** Timeout used by {@link #connect(Backend)}. */
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

  static final String MDC_BACKEND = "backend";

  private final Map<Backend, CadClientPort> clients;
  private final ConnectionRegistry registry = new ConnectionRegistry();
  private final ProbeStrategy probeStrategy;
  private final ScheduledExecutorService control;
  private final ProbeSettings settings;
  private final MetricsPort metrics;
  private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean cycleInProgress = new AtomicBoolean();
  private final Object lifecycleLock = new Object();

  private ScheduledFuture<?> tickHandle;
  private boolean stopped;

  /**
   * Creates a manager with its own control thread.
   *
   * @param clients one adapter per backend; every {@link Backend} must be present
   * @param probeStrategy executes probe tasks; owned by the manager from now on
   * @param settings probe timing and liveness policy
   * @param metrics metrics sink
   */
  public ConnectionManager(
      Map<Backend, CadClientPort> clients,
      ProbeStrategy probeStrategy,
      ProbeSettings settings,
      MetricsPort metrics) {
    this(clients, probeStrategy, settings, metrics,
        ExecutorFactories.newControlScheduler("sketchbridge-control"));
  }

  /**
   * Creates a manager over an explicit control scheduler, which the manager then owns.
   *
   * @param clients one adapter per backend; every {@link Backend} must be present
   * @param probeStrategy executes probe tasks
   * @param settings probe timing and liveness policy
   * @param metrics metrics sink
   * @param control single-threaded scheduler running ticks and result collection
   */
  public ConnectionManager(
      Map<Backend, CadClientPort> clients,
      ProbeStrategy probeStrategy,
      ProbeSettings settings,
      MetricsPort metrics,
      ScheduledExecutorService control) {
    Objects.requireNonNull(clients, "clients");
    Map<Backend, CadClientPort> copy = new EnumMap<>(Backend.class);
    for (Backend backend : Backend.all()) {
      copy.put(backend, Objects.requireNonNull(clients.get(backend), () -> "no client for " + backend));
    }
    this.clients = copy;
    this.probeStrategy = Objects.requireNonNull(probeStrategy, "probeStrategy");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.control = Objects.requireNonNull(control, "control");
  }

  /**
   * Lists every backend in declaration order.
   *
   * @return all backends
   */
  public static List<Backend> backends() {
    return Backend.all();
  }

  /**
   * Human-readable backend name.
   *
   * @param backend backend
   * @return display name such as {@code "Fusion 360"}
   */
  public static String displayName(Backend backend) {
    return backend.displayName();
  }

  public void addListener(ConnectionListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(ConnectionListener listener) {
    listeners.remove(listener);
  }

  /**
   * Starts monitoring. The first cycle runs immediately, later cycles every {@code interval}.
   *
   * @param interval delay between ticks
   * @throws IllegalStateException if already started or stopped
   */
  public void start(Duration interval) {
    Objects.requireNonNull(interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    synchronized (lifecycleLock) {
      if (stopped) {
        throw new IllegalStateException("connection manager already stopped");
      }
      if (tickHandle != null) {
        throw new IllegalStateException("connection manager already started");
      }
      tickHandle = control.scheduleAtFixedRate(
          this::tick, 0L, interval.toMillis(), TimeUnit.MILLISECONDS);
    }
    log.info("Connection monitoring started (interval={} ms, strategy={}, liveness={})",
        interval.toMillis(), probeStrategy.name(), settings.livenessPolicy());
  }

  /** Starts monitoring with the configured interval. */
  public void start() {
    start(settings.interval());
  }

  /**
   * Stops the tick timer and requests probe-pool shutdown. Returns without waiting for in-flight probes; their
   * results are discarded.
   */
  public void stop() {
    synchronized (lifecycleLock) {
      if (stopped) {
        return;
      }
      stopped = true;
      if (tickHandle != null) {
        tickHandle.cancel(false);
      }
    }
    probeStrategy.shutdown();
    control.shutdown();
    // pending collect tasks are dropped with the control thread
    cycleInProgress.set(false);
    log.info("Connection monitoring stopped");
  }

  @Override
  public void close() {
    stop();
  }

  public boolean isConnected(Backend backend) {
    return registry.isConnected(backend);
  }

  /**
   * Last cached status of a backend.
   *
   * @param backend backend
   * @return immutable status snapshot; empty while disconnected
   */
  public Map<String, Object> status(Backend backend) {
    return registry.status(backend);
  }

  /**
   * Connects with {@link #DEFAULT_CONNECT_TIMEOUT}.
   *
   * @param backend backend to connect
   * @return {@code true} when connected
   */
  public boolean connect(Backend backend) {
    return connect(backend, DEFAULT_CONNECT_TIMEOUT);
  }

  /**
   * Connects synchronously on the caller's thread and publishes the outcome unconditionally.
   *
   * @param backend backend to connect
   * @param timeout connect timeout handed to the adapter
   * @return {@code true} when connected
   */
  public boolean connect(Backend backend, Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    CadClientPort client = client(backend);
    ProbeResult result;
    try {
      if (client.connect(timeout)) {
        result = ProbeResult.connected(client.status());
      } else {
        log.warn("{} is not reachable", backend.displayName());
        result = ProbeResult.DISCONNECTED;
      }
    } catch (RuntimeException ex) {
      log.warn("Connecting to {} failed: {}", backend.displayName(), ex.toString());
      result = ProbeResult.DISCONNECTED;
    }
    registry.record(backend).update(result);
    // listeners run after the record is released so a slow one cannot block reads or other writers
    if (!result.status().isEmpty()) {
      fireStatusUpdated(backend, result.status());
    }
    fireConnectivityChanged(backend, result.connected());
    return result.connected();
  }

  /**
   * Disconnects a backend. Adapter failures are logged; the backend ends up disconnected either way.
   *
   * @param backend backend to disconnect
   */
  public void disconnect(Backend backend) {
    CadClientPort client = client(backend);
    try {
      client.disconnect();
    } catch (RuntimeException ex) {
      log.warn("Disconnecting from {} failed: {}", backend.displayName(), ex.toString());
    }
    registry.record(backend).update(ProbeResult.DISCONNECTED);
    fireConnectivityChanged(backend, false);
  }

  public List<SketchInfo> listSketches(Backend backend) {
    if (!isConnected(backend)) {
      return List.of();
    }
    try {
      List<SketchInfo> sketches = client(backend).listSketches();
      return sketches == null ? List.of() : List.copyOf(sketches);
    } catch (RuntimeException ex) {
      log.warn("Listing sketches on {} failed: {}", backend.displayName(), ex.toString());
      return List.of();
    }
  }

  public List<PlaneInfo> listPlanes(Backend backend) {
    if (!isConnected(backend)) {
      return List.of();
    }
    try {
      List<PlaneInfo> planes = client(backend).listPlanes();
      return planes == null ? List.of() : List.copyOf(planes);
    } catch (RuntimeException ex) {
      log.warn("Listing planes on {} failed: {}", backend.displayName(), ex.toString());
      return List.of();
    }
  }

  /**
   * Exports a sketch.
   *
   * @param backend source backend
   * @param sketchName backend-side sketch name
   * @return exported document, or empty when disconnected or the export failed
   */
  public Optional<SketchDocument> exportSketch(Backend backend, String sketchName) {
    if (!isConnected(backend)) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(client(backend).exportSketch(sketchName));
    } catch (RuntimeException ex) {
      log.warn("Exporting {} from {} failed: {}", sketchName, backend.displayName(), ex.toString());
      return Optional.empty();
    }
  }

  /**
   * Imports a sketch and then asks the backend to open it. A failed open does not affect the result.
   *
   * @param backend target backend
   * @param document sketch to import
   * @param name target name; {@code null} lets the backend choose
   * @param planeId target plane; {@code null} lets the backend choose
   * @return name of the created sketch, or empty when disconnected or the import failed
   */
  public Optional<String> importSketch(Backend backend, SketchDocument document, String name, String planeId) {
    Objects.requireNonNull(document, "document");
    if (!isConnected(backend)) {
      return Optional.empty();
    }
    CadClientPort client = client(backend);
    String created;
    try {
      created = client.importSketch(document, name, planeId);
    } catch (RuntimeException ex) {
      log.warn("Importing {} into {} failed: {}", document.name(), backend.displayName(), ex.toString());
      return Optional.empty();
    }
    if (created == null || created.isBlank()) {
      log.warn("{} did not report a name for imported sketch {}", backend.displayName(), document.name());
      return Optional.empty();
    }
    openQuietly(backend, client, created);
    return Optional.of(created);
  }

  /**
   * Runs one probe cycle now, unless one is still collecting.
   *
   * @return {@code true} when a cycle was dispatched, {@code false} when it was skipped
   */
  public boolean probeNow() {
    return probeCycle();
  }

  boolean isCycleInProgress() {
    return cycleInProgress.get();
  }

  private void tick() {
    try {
      probeCycle();
    } catch (RuntimeException ex) {
      // a throwing periodic task would be silently cancelled by the scheduler
      log.error("Probe tick failed", ex);
    }
  }

  boolean probeCycle() {
    if (!cycleInProgress.compareAndSet(false, true)) {
      metrics.increment("probe.cycle.skipped");
      log.debug("Previous probe cycle still collecting; skipping tick");
      return false;
    }
    metrics.increment("probe.cycle.started");
    long startedNanos = System.nanoTime();
    ProbeRound round;
    try {
      round = probeStrategy.dispatch(buildProbes());
    } catch (RuntimeException ex) {
      log.error("Dispatching probe cycle via {} failed", probeStrategy.name(), ex);
      cycleInProgress.set(false);
      return false;
    }
    collect(round, startedNanos);
    return true;
  }

  private Map<Backend, Callable<ProbeResult>> buildProbes() {
    Map<Backend, Callable<ProbeResult>> probes = new EnumMap<>(Backend.class);
    for (Backend backend : Backend.all()) {
      boolean cachedConnected = registry.isConnected(backend);
      probes.put(backend, () -> probe(backend, cachedConnected));
    }
    return probes;
  }

  private ProbeResult probe(Backend backend, boolean cachedConnected) {
    CadClientPort client = clients.get(backend);
    MDC.put(MDC_BACKEND, backend.configKey());
    try {
      if (!isAlive(client, cachedConnected) && !client.connect(settings.probeTimeout())) {
        return ProbeResult.DISCONNECTED;
      }
      return ProbeResult.connected(client.status());
    } catch (RuntimeException ex) {
      metrics.increment("probe.connect.failed");
      log.debug("Probe of {} failed: {}", backend.displayName(), ex.toString());
      return ProbeResult.DISCONNECTED;
    } finally {
      MDC.remove(MDC_BACKEND);
    }
  }

  private boolean isAlive(CadClientPort client, boolean cachedConnected) {
    switch (settings.livenessPolicy()) {
      case REVALIDATE:
        return client.isConnected();
      case TRUST_CACHED:
      default:
        return cachedConnected;
    }
  }

  private void collect(ProbeRound round, long startedNanos) {
    try {
      round.drainCompleted().forEach(this::applyProbeResult);
    } catch (RuntimeException ex) {
      log.error("Collecting probe results failed", ex);
    }
    if (round.isComplete()) {
      metrics.observe("probe.cycle.latencyNanos", System.nanoTime() - startedNanos);
      cycleInProgress.set(false);
      return;
    }
    try {
      control.schedule(
          () -> collect(round, startedNanos),
          settings.collectPollInterval().toMillis(),
          TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      log.debug("Control thread stopped; abandoning probe cycle");
      cycleInProgress.set(false);
    }
  }

  private void applyProbeResult(Backend backend, ProbeResult result) {
    boolean previous = registry.record(backend).update(result);
    if (!result.status().isEmpty()) {
      fireStatusUpdated(backend, result.status());
    }
    if (previous != result.connected()) {
      metrics.increment("connection.changed");
      log.info("{} {}", backend.displayName(), result.connected() ? "connected" : "disconnected");
      fireConnectivityChanged(backend, result.connected());
    }
  }

  private void openQuietly(Backend backend, CadClientPort client, String sketchName) {
    try {
      client.openSketch(sketchName);
    } catch (RuntimeException ex) {
      log.debug("Opening {} on {} failed: {}", sketchName, backend.displayName(), ex.toString());
    }
  }

  private void fireConnectivityChanged(Backend backend, boolean connected) {
    for (ConnectionListener listener : listeners) {
      try {
        listener.connectivityChanged(backend, connected);
      } catch (RuntimeException ex) {
        log.warn("Connection listener {} failed", listener, ex);
      }
    }
  }

  private void fireStatusUpdated(Backend backend, Map<String, Object> status) {
    for (ConnectionListener listener : listeners) {
      try {
        listener.statusUpdated(backend, status);
      } catch (RuntimeException ex) {
        log.warn("Status listener {} failed", listener, ex);
      }
    }
  }

  private CadClientPort client(Backend backend) {
    return clients.get(Objects.requireNonNull(backend, "backend"));
  }
}
