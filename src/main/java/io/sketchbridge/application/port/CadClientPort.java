package io.sketchbridge.application.port;

import io.sketchbridge.domain.cad.PlaneInfo;
import io.sketchbridge.domain.cad.SketchInfo;
import io.sketchbridge.domain.sketch.SketchDocument;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Outbound port to one CAD backend's RPC server.
 * <p><strong>Why:</strong> Keeps the connection manager independent of each backend's wire protocol; the four
 * concrete RPC adapters live outside this codebase and plug in through {@link CadClientFactory}.</p>
 * <p><strong>Role:</strong> Driven port implemented by RPC adapters and wrapped by
 * {@code io.sketchbridge.infrastructure.client.LazyCadClient}.</p>
 * <p><strong>Failure contract:</strong> Any method may throw any {@link RuntimeException} (timeouts, broken pipes,
 * remote faults). Callers in the application layer convert every failure into a disconnected state or an
 * empty result; no failure is propagated past them.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from a probe worker and from the thread
 * performing a manual connect; they need not support two concurrent calls of the same operation.</p>
 * <p><strong>Performance:</strong> Every call may block on network I/O for up to its timeout.</p>
 *
 * @since 0.1.0
 */
public interface CadClientPort {

  /**
   * Opens (or re-opens) the RPC session.
   *
   * @param timeout upper bound for establishing the session
   * @return {@code true} when the backend answered and the session is usable
   */
  boolean connect(Duration timeout);

  /** Closes the RPC session; safe to call when not connected. */
  void disconnect();

  /**
   * Reports the adapter's own view of its session.
   *
   * @return {@code true} if the adapter believes its session is open
   */
  boolean isConnected();

  /**
   * Fetches backend status, e.g. {@code active_document} and {@code sketch_count}.
   *
   * @return status entries; possibly empty
   */
  Map<String, Object> status();

  /**
   * Lists sketches in the backend's active document.
   *
   * @return sketch summaries in backend order
   */
  List<SketchInfo> listSketches();

  /**
   * Lists planes a new sketch may be placed on.
   *
   * @return planes in backend order
   */
  List<PlaneInfo> listPlanes();

  /**
   * Exports one sketch.
   *
   * @param name sketch name as reported by {@link #listSketches()}
   * @return exported document
   */
  SketchDocument exportSketch(String name);

  /**
   * Creates a new sketch from a document.
   *
   * @param document geometry to create
   * @param name requested sketch name; {@code null} lets the backend choose
   * @param planeId target plane id; {@code null} selects the backend default
   * @return name of the created sketch
   */
  String importSketch(SketchDocument document, String name, String planeId);

  /**
   * Opens a sketch for editing in the backend UI.
   *
   * @param name sketch name
   * @return {@code true} if the backend opened it
   */
  boolean openSketch(String name);
}
