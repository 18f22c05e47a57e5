package io.sketchbridge.domain.sketch;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Standalone point primitive.
 *
 * @param position location of the point
 * @param construction construction geometry flag
 * @since 0.1.0
 */
public record SketchPoint(Point2D position, boolean construction) implements Primitive {

  public SketchPoint {
    Objects.requireNonNull(position, "position");
  }

  public SketchPoint(Point2D position) {
    this(position, false);
  }

  @Override
  public List<Point2D> representativePoints() {
    return List.of(position);
  }

  @Override
  public SketchPoint mapPoints(UnaryOperator<Point2D> mapper) {
    return new SketchPoint(mapper.apply(position), construction);
  }
}
