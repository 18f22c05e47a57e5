package io.sketchbridge.application.transfer;

import io.sketchbridge.application.connection.ConnectionManager;
import io.sketchbridge.application.port.MetricsPort;
import io.sketchbridge.application.port.SketchSelector;
import io.sketchbridge.application.transform.SketchTransforms;
import io.sketchbridge.application.transform.TransformRequest;
import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.domain.cad.PlaneInfo;
import io.sketchbridge.domain.cad.SketchInfo;
import io.sketchbridge.domain.sketch.SketchDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves sketches between backends: collect exports from one, deliver transforms and imports into another.
 *
 * <p>All backend access goes through the {@link ConnectionManager}, so a disconnected or failing backend shows up
 * here as empty results rather than exceptions.</p>
 *
 * @since 0.1.0
 */
public final class TransferUseCase {
  private static final Logger log = LoggerFactory.getLogger(TransferUseCase.class);

  /** Plane used when the caller does not pick one. */
  public static final String DEFAULT_PLANE_ID = "XY";

  private final ConnectionManager connections;
  private final MetricsPort metrics;
  private final AtomicInteger sketchCounter = new AtomicInteger();

  public TransferUseCase(ConnectionManager connections, MetricsPort metrics) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Collects sketches from a backend.
   *
   * <p>A single offered sketch is collected without consulting {@code selector}. Each selected sketch is exported
   * independently; one failure does not stop the rest.</p>
   *
   * @param backend source backend
   * @param selector picks sketches when two or more are offered
   * @return outcome and collected sketches
   */
  public CollectResult collect(Backend backend, SketchSelector selector) {
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(selector, "selector");
    String source = backend.displayName();

    List<SketchInfo> available = connections.listSketches(backend);
    if (available.isEmpty()) {
      log.info("No sketches found in {}", source);
      return CollectResult.of(CollectResult.Outcome.NO_SKETCHES);
    }

    List<SketchInfo> selected = available.size() == 1 ? available : selector.select(backend, available);
    if (selected == null || selected.isEmpty()) {
      log.info("No sketches selected from {}", source);
      return CollectResult.of(CollectResult.Outcome.NOTHING_SELECTED);
    }

    List<CollectedSketch> collected = new ArrayList<>(selected.size());
    for (SketchInfo info : selected) {
      Optional<SketchDocument> exported = connections.exportSketch(backend, info.name());
      if (exported.isEmpty()) {
        metrics.increment("transfer.collect.failed");
        continue;
      }
      SketchDocument document = exported.get();
      String key = backend.configKey() + '_' + sketchCounter.incrementAndGet() + '_' + document.name();
      collected.add(new CollectedSketch(key, source, document));
      metrics.increment("transfer.collect.exported");
    }

    if (collected.isEmpty()) {
      log.warn("Could not collect sketches from {}", source);
      return CollectResult.of(CollectResult.Outcome.FAILED);
    }
    log.info("Collected {} sketch(es) from {}", collected.size(), source);
    return new CollectResult(CollectResult.Outcome.COLLECTED, collected);
  }

  /**
   * Transforms a sketch and imports it into a backend. The input document is never modified.
   *
   * @param backend target backend
   * @param sketch sketch to deliver
   * @param name target name; {@code null} lets the backend choose
   * @param planeId target plane; {@code null} lets the backend choose
   * @param request transform applied before import; identity requests skip the transform
   * @return name of the created sketch, or empty on failure
   */
  public Optional<String> deliver(
      Backend backend, SketchDocument sketch, String name, String planeId, TransformRequest request) {
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(sketch, "sketch");
    Objects.requireNonNull(request, "request");

    SketchDocument outgoing = request.isIdentity() ? sketch : SketchTransforms.transform(sketch, request);
    Optional<String> created = connections.importSketch(backend, outgoing, name, planeId);
    if (created.isPresent()) {
      metrics.increment("transfer.deliver.imported");
      log.info("Exported '{}' to {} as '{}'", sketch.name(), backend.displayName(), created.get());
    } else {
      metrics.increment("transfer.deliver.failed");
      log.warn("Could not export '{}' to {}", sketch.name(), backend.displayName());
    }
    return created;
  }

  /**
   * Delivers without transforming.
   *
   * @param backend target backend
   * @param sketch sketch to deliver
   * @return name of the created sketch, or empty on failure
   */
  public Optional<String> deliver(Backend backend, SketchDocument sketch) {
    return deliver(backend, sketch, null, DEFAULT_PLANE_ID, TransformRequest.IDENTITY);
  }

  /**
   * Planes a sketch can be delivered onto.
   *
   * @param backend target backend
   * @return the backend's planes, or the principal planes when it reports none
   */
  public List<PlaneInfo> planesFor(Backend backend) {
    List<PlaneInfo> planes = connections.listPlanes(backend);
    return planes.isEmpty() ? PlaneInfo.PRINCIPAL_PLANES : planes;
  }

  /**
   * One-line summary of a backend status map.
   *
   * @param status status as cached by the connection manager
   * @return e.g. {@code "bracket.FCStd | 3 sketches"}, or {@code "Connected"} when nothing is known
   */
  public static String describeStatus(Map<String, Object> status) {
    List<String> parts = new ArrayList<>(2);
    Object document = status.get("active_document");
    if (document != null && !String.valueOf(document).isEmpty()) {
      parts.add(String.valueOf(document));
    }
    if (status.containsKey("sketch_count")) {
      parts.add(String.format(Locale.ROOT, "%s sketches", status.get("sketch_count")));
    }
    return parts.isEmpty() ? "Connected" : String.join(" | ", parts);
  }
}
