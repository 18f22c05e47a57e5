package io.sketchbridge.domain.sketch;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * <strong>What:</strong> A piece of sketch geometry whose defining points can be moved.
 * <p><strong>Why:</strong> Lets the transform pipeline treat every variant uniformly: it only needs the points that
 * describe a primitive and a way to rebuild the primitive from moved points.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable records.</p>
 *
 * @since 0.1.0
 */
public interface Primitive {

  /**
   * Indicates construction (reference-only) geometry.
   *
   * @return {@code true} for construction geometry
   */
  boolean construction();

  /**
   * Points that stand for this primitive when computing a centroid.
   *
   * @return ordered, immutable list of points
   */
  List<Point2D> representativePoints();

  /**
   * Returns a copy of this primitive with every coordinate passed through {@code mapper}.
   * Scalar attributes (radii, direction flags, knots) are preserved.
   *
   * @param mapper point mapping; must not be {@code null}
   * @return new primitive of the same variant
   */
  Primitive mapPoints(UnaryOperator<Point2D> mapper);
}
