package io.sketchbridge.application.transform;

/**
 * Rotation center used by {@link SketchTransforms#transform}.
 *
 * @since 0.1.0
 */
public enum PivotPolicy {
  /** Rotate about {@code (0, 0)}. */
  ORIGIN,
  /** Rotate about the mean of the sketch's representative points. */
  CENTROID
}
