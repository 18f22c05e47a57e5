package io.sketchbridge.domain.sketch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * B-spline defined by its control polygon, knot vector, and degree.
 *
 * @param controlPoints ordered control points; at least two
 * @param knots knot vector; may be empty when the backend derives it
 * @param degree polynomial degree; must be positive
 * @param construction construction geometry flag
 * @since 0.1.0
 */
public record Spline(List<Point2D> controlPoints, List<Double> knots, int degree, boolean construction)
    implements Primitive {

  public Spline {
    controlPoints = List.copyOf(Objects.requireNonNull(controlPoints, "controlPoints"));
    knots = List.copyOf(Objects.requireNonNull(knots, "knots"));
    if (controlPoints.size() < 2) {
      throw new IllegalArgumentException("spline needs at least 2 control points");
    }
    if (degree < 1) {
      throw new IllegalArgumentException("degree must be positive (was " + degree + ")");
    }
  }

  public Spline(List<Point2D> controlPoints, List<Double> knots, int degree) {
    this(controlPoints, knots, degree, false);
  }

  @Override
  public List<Point2D> representativePoints() {
    return controlPoints;
  }

  @Override
  public Spline mapPoints(UnaryOperator<Point2D> mapper) {
    List<Point2D> moved = new ArrayList<>(controlPoints.size());
    for (Point2D point : controlPoints) {
      moved.add(mapper.apply(point));
    }
    return new Spline(moved, knots, degree, construction);
  }
}
