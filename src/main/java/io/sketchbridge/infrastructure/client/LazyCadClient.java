package io.sketchbridge.infrastructure.client;

import io.sketchbridge.application.port.CadClientPort;
import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.domain.cad.PlaneInfo;
import io.sketchbridge.domain.cad.SketchInfo;
import io.sketchbridge.domain.sketch.SketchDocument;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Defers building a backend adapter until the first call that needs a live session.
 *
 * <p>{@link #isConnected()} and {@link #disconnect()} answer from the unbuilt state and never trigger
 * construction. If the supplier throws, the exception surfaces from the triggering call and the next call tries
 * again.</p>
 *
 * @since 0.1.0
 */
public final class LazyCadClient implements CadClientPort {
  private static final Logger log = LoggerFactory.getLogger(LazyCadClient.class);

  private final Backend backend;
  private final Supplier<? extends CadClientPort> factory;
  private volatile CadClientPort delegate;

  public LazyCadClient(Backend backend, Supplier<? extends CadClientPort> factory) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Indicates whether the underlying adapter has been built.
   *
   * @return {@code true} after the first constructing call succeeded
   */
  public boolean isInitialized() {
    return delegate != null;
  }

  @Override
  public boolean connect(Duration timeout) {
    return delegate().connect(timeout);
  }

  @Override
  public void disconnect() {
    CadClientPort current = delegate;
    if (current != null) {
      current.disconnect();
    }
  }

  @Override
  public boolean isConnected() {
    CadClientPort current = delegate;
    return current != null && current.isConnected();
  }

  @Override
  public Map<String, Object> status() {
    return delegate().status();
  }

  @Override
  public List<SketchInfo> listSketches() {
    return delegate().listSketches();
  }

  @Override
  public List<PlaneInfo> listPlanes() {
    return delegate().listPlanes();
  }

  @Override
  public SketchDocument exportSketch(String name) {
    return delegate().exportSketch(name);
  }

  @Override
  public String importSketch(SketchDocument document, String name, String planeId) {
    return delegate().importSketch(document, name, planeId);
  }

  @Override
  public boolean openSketch(String name) {
    return delegate().openSketch(name);
  }

  private CadClientPort delegate() {
    CadClientPort current = delegate;
    if (current != null) {
      return current;
    }
    synchronized (this) {
      if (delegate == null) {
        CadClientPort created = Objects.requireNonNull(factory.get(), "factory returned null");
        log.debug("Created {} adapter {}", backend.displayName(), created.getClass().getName());
        delegate = created;
      }
      return delegate;
    }
  }

  @Override
  public String toString() {
    return "LazyCadClient[" + backend.displayName() + (isInitialized() ? ", initialized]" : "]");
  }
}
