package io.sketchbridge.domain.sketch;

/**
 * Immutable 2D coordinate in sketch space (millimetres).
 *
 * @param x horizontal coordinate
 * @param y vertical coordinate
 * @since 0.1.0
 */
public record Point2D(double x, double y) {

  /** The sketch origin. */
  public static final Point2D ORIGIN = new Point2D(0.0, 0.0);

  /**
   * Returns this point shifted by the given offsets.
   *
   * @param dx horizontal offset
   * @param dy vertical offset
   * @return translated point
   */
  public Point2D translate(double dx, double dy) {
    return new Point2D(x + dx, y + dy);
  }

  /**
   * Euclidean distance to another point.
   *
   * @param other other point; must not be {@code null}
   * @return distance
   */
  public double distanceTo(Point2D other) {
    return Math.hypot(other.x - x, other.y - y);
  }
}
