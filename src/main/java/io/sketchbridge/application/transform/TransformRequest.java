package io.sketchbridge.application.transform;

import io.sketchbridge.validation.Numbers;
import java.util.Objects;

/**
 * Rigid transform to apply to a sketch before it is imported into a backend.
 *
 * @param dx translation along X (mm)
 * @param dy translation along Y (mm)
 * @param angleDegrees rotation in degrees, counter-clockwise positive
 * @param pivotPolicy rotation center
 * @param stripConstraints drop every constraint from the transformed copy
 * @since 0.1.0
 */
public record TransformRequest(
    double dx, double dy, double angleDegrees, PivotPolicy pivotPolicy, boolean stripConstraints) {

  /** No movement, centroid pivot, constraints kept. */
  public static final TransformRequest IDENTITY =
      new TransformRequest(0.0, 0.0, 0.0, PivotPolicy.CENTROID, false);

  public TransformRequest {
    Numbers.requireFinite("dx", dx);
    Numbers.requireFinite("dy", dy);
    Numbers.requireFinite("angleDegrees", angleDegrees);
    Objects.requireNonNull(pivotPolicy, "pivotPolicy");
  }

  /**
   * Pure translation.
   *
   * @param dx translation along X
   * @param dy translation along Y
   * @return request
   */
  public static TransformRequest translation(double dx, double dy) {
    return new TransformRequest(dx, dy, 0.0, PivotPolicy.CENTROID, false);
  }

  /**
   * Pure rotation.
   *
   * @param angleDegrees rotation, counter-clockwise positive
   * @param pivotPolicy rotation center
   * @return request
   */
  public static TransformRequest rotation(double angleDegrees, PivotPolicy pivotPolicy) {
    return new TransformRequest(0.0, 0.0, angleDegrees, pivotPolicy, false);
  }

  public TransformRequest withStripConstraints(boolean strip) {
    return new TransformRequest(dx, dy, angleDegrees, pivotPolicy, strip);
  }

  /**
   * True when applying this request would leave the sketch unchanged, so it can be sent as-is.
   *
   * @return {@code true} for zero translation, zero rotation, and constraints kept
   */
  public boolean isIdentity() {
    return dx == 0.0 && dy == 0.0 && angleDegrees == 0.0 && !stripConstraints;
  }
}
