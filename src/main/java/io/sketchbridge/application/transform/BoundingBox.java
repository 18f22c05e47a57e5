package io.sketchbridge.application.transform;

/**
 * Axis-aligned extent of a sketch.
 *
 * @param minX smallest X
 * @param minY smallest Y
 * @param maxX largest X
 * @param maxY largest Y
 * @since 0.1.0
 */
public record BoundingBox(double minX, double minY, double maxX, double maxY) {

  /** Extent reported for a sketch without geometry. */
  public static final BoundingBox EMPTY = new BoundingBox(0.0, 0.0, 0.0, 0.0);

  public double width() {
    return maxX - minX;
  }

  public double height() {
    return maxY - minY;
  }
}
