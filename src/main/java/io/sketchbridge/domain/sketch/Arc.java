package io.sketchbridge.domain.sketch;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Circular arc running from {@code startPoint} to {@code endPoint} around {@code center}.
 *
 * @param center arc center
 * @param startPoint first endpoint
 * @param endPoint second endpoint
 * @param radius radius; must be positive
 * @param counterClockwise sweep direction from start to end
 * @param construction construction geometry flag
 * @since 0.1.0
 */
public record Arc(
    Point2D center,
    Point2D startPoint,
    Point2D endPoint,
    double radius,
    boolean counterClockwise,
    boolean construction) implements Primitive {

  public Arc {
    Objects.requireNonNull(center, "center");
    Objects.requireNonNull(startPoint, "startPoint");
    Objects.requireNonNull(endPoint, "endPoint");
    if (!(radius > 0.0)) {
      throw new IllegalArgumentException("radius must be positive (was " + radius + ")");
    }
  }

  public Arc(Point2D center, Point2D startPoint, Point2D endPoint, double radius, boolean counterClockwise) {
    this(center, startPoint, endPoint, radius, counterClockwise, false);
  }

  @Override
  public List<Point2D> representativePoints() {
    return List.of(center, startPoint, endPoint);
  }

  @Override
  public Arc mapPoints(UnaryOperator<Point2D> mapper) {
    return new Arc(
        mapper.apply(center),
        mapper.apply(startPoint),
        mapper.apply(endPoint),
        radius,
        counterClockwise,
        construction);
  }
}
