package io.sketchbridge.domain.sketch;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Straight segment between two points.
 *
 * @param start start point
 * @param end end point
 * @param construction construction geometry flag
 * @since 0.1.0
 */
public record Line(Point2D start, Point2D end, boolean construction) implements Primitive {

  public Line {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
  }

  /**
   * Creates regular (non-construction) line geometry.
   *
   * @param start start point
   * @param end end point
   */
  public Line(Point2D start, Point2D end) {
    this(start, end, false);
  }

  /**
   * Segment length.
   *
   * @return distance between start and end
   */
  public double length() {
    return start.distanceTo(end);
  }

  @Override
  public List<Point2D> representativePoints() {
    return List.of(start, end);
  }

  @Override
  public Line mapPoints(UnaryOperator<Point2D> mapper) {
    return new Line(mapper.apply(start), mapper.apply(end), construction);
  }
}
