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
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Placeholder adapter used when no {@link io.sketchbridge.application.port.CadClientFactory} is registered for a
 * backend. Connecting always fails; the reason is logged at WARN once and at DEBUG afterwards.
 */
public final class DisabledCadClient implements CadClientPort {
  private static final Logger log = LoggerFactory.getLogger(DisabledCadClient.class);

  private final Backend backend;
  private final String reason;
  private final AtomicBoolean reported = new AtomicBoolean();

  /**
   * Creates a disabled adapter.
   *
   * @param backend backend this placeholder stands in for
   * @param reason why no real adapter is available
   */
  public DisabledCadClient(Backend backend, String reason) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.reason = (reason == null || reason.isBlank()) ? "no adapter configured" : reason;
  }

  public String reason() {
    return reason;
  }

  /**
   * Always fails.
   *
   * @return always {@code false}
   */
  @Override
  public boolean connect(Duration timeout) {
    if (reported.compareAndSet(false, true)) {
      log.warn("{} adapter disabled: {}", backend.displayName(), reason);
    } else {
      log.debug("{} adapter disabled: {}", backend.displayName(), reason);
    }
    return false;
  }

  @Override
  public void disconnect() {}

  @Override
  public boolean isConnected() {
    return false;
  }

  @Override
  public Map<String, Object> status() {
    return Map.of();
  }

  @Override
  public List<SketchInfo> listSketches() {
    return List.of();
  }

  @Override
  public List<PlaneInfo> listPlanes() {
    return List.of();
  }

  @Override
  public SketchDocument exportSketch(String name) {
    throw new UnsupportedOperationException(backend.displayName() + " adapter not configured");
  }

  @Override
  public String importSketch(SketchDocument document, String name, String planeId) {
    throw new UnsupportedOperationException(backend.displayName() + " adapter not configured");
  }

  @Override
  public boolean openSketch(String name) {
    return false;
  }
}
