package io.sketchbridge.domain.sketch;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Full circle.
 *
 * @param center circle center
 * @param radius radius; must be positive
 * @param construction construction geometry flag
 * @since 0.1.0
 */
public record Circle(Point2D center, double radius, boolean construction) implements Primitive {

  public Circle {
    Objects.requireNonNull(center, "center");
    if (!(radius > 0.0)) {
      throw new IllegalArgumentException("radius must be positive (was " + radius + ")");
    }
  }

  public Circle(Point2D center, double radius) {
    this(center, radius, false);
  }

  @Override
  public List<Point2D> representativePoints() {
    return List.of(center);
  }

  @Override
  public Circle mapPoints(UnaryOperator<Point2D> mapper) {
    return new Circle(mapper.apply(center), radius, construction);
  }
}
