package io.sketchbridge.application.transform;

import io.sketchbridge.domain.sketch.Arc;
import io.sketchbridge.domain.sketch.Circle;
import io.sketchbridge.domain.sketch.Point2D;
import io.sketchbridge.domain.sketch.Primitive;
import io.sketchbridge.domain.sketch.SketchDocument;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Rigid 2D transforms over {@link SketchDocument}s.
 * <p><strong>Why:</strong> Sketches moving between backends usually need to be repositioned. Moving geometry by
 * rewriting coordinates bypasses the target's constraint solver, so callers may strip constraints to keep the
 * solver from pulling the moved geometry back.</p>
 * <p><strong>Contract:</strong> Every operation returns a new document; the input is never modified. Each
 * coordinate is rotated about the pivot first and translated second, with the pivot expressed in the
 * untransformed frame. Radii and arc directions are unchanged.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use on distinct documents.</p>
 *
 * @since 0.1.0
 */
public final class SketchTransforms {

  private SketchTransforms() {
    // Utility
  }

  /**
   * Applies a transform request.
   *
   * @param document source document; not modified
   * @param request transform to apply
   * @return transformed copy
   */
  public static SketchDocument transform(SketchDocument document, TransformRequest request) {
    Objects.requireNonNull(request, "request");
    return transform(
        document,
        request.dx(),
        request.dy(),
        request.angleDegrees(),
        request.pivotPolicy(),
        request.stripConstraints());
  }

  /**
   * Translates and rotates every coordinate of a copy of {@code document}.
   *
   * <p>With {@link PivotPolicy#CENTROID} and a non-zero angle the pivot is the centroid of the source document;
   * otherwise it is the origin.</p>
   *
   * @param document source document; not modified
   * @param dx translation along X
   * @param dy translation along Y
   * @param angleDegrees rotation, counter-clockwise positive
   * @param pivotPolicy rotation center
   * @param stripConstraints remove every constraint from the copy
   * @return transformed copy
   */
  public static SketchDocument transform(
      SketchDocument document,
      double dx,
      double dy,
      double angleDegrees,
      PivotPolicy pivotPolicy,
      boolean stripConstraints) {
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(pivotPolicy, "pivotPolicy");
    Point2D pivot = pivotPolicy == PivotPolicy.CENTROID && angleDegrees != 0.0
        ? centroid(document)
        : Point2D.ORIGIN;
    return apply(document, dx, dy, angleDegrees, pivot, stripConstraints);
  }

  /**
   * Applies a transform request rotating about an explicit pivot; the request's pivot policy is ignored.
   *
   * @param document source document; not modified
   * @param request translation, rotation, and constraint handling
   * @param pivot rotation center in the untransformed frame
   * @return transformed copy
   */
  public static SketchDocument transformAbout(SketchDocument document, TransformRequest request, Point2D pivot) {
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(pivot, "pivot");
    return apply(document, request.dx(), request.dy(), request.angleDegrees(), pivot, request.stripConstraints());
  }

  /**
   * Translation only; constraints are kept.
   *
   * @param document source document
   * @param dx translation along X
   * @param dy translation along Y
   * @return translated copy
   */
  public static SketchDocument translate(SketchDocument document, double dx, double dy) {
    return transform(document, dx, dy, 0.0, PivotPolicy.ORIGIN, false);
  }

  /**
   * Rotation only; constraints are kept.
   *
   * @param document source document
   * @param angleDegrees rotation, counter-clockwise positive
   * @param pivotPolicy rotation center
   * @return rotated copy
   */
  public static SketchDocument rotate(SketchDocument document, double angleDegrees, PivotPolicy pivotPolicy) {
    return transform(document, 0.0, 0.0, angleDegrees, pivotPolicy, false);
  }

  /**
   * Rotates {@code point} about {@code pivot}, then translates it.
   *
   * @param point point to move
   * @param dx translation along X
   * @param dy translation along Y
   * @param angleDegrees rotation, counter-clockwise positive
   * @param pivot rotation center
   * @return moved point
   */
  public static Point2D transformPoint(Point2D point, double dx, double dy, double angleDegrees, Point2D pivot) {
    double x = point.x();
    double y = point.y();
    if (angleDegrees != 0.0) {
      double radians = Math.toRadians(angleDegrees);
      double cos = Math.cos(radians);
      double sin = Math.sin(radians);
      double relX = x - pivot.x();
      double relY = y - pivot.y();
      x = relX * cos - relY * sin + pivot.x();
      y = relX * sin + relY * cos + pivot.y();
    }
    // a zero offset leaves the component untouched so -0.0 survives
    if (dx != 0.0) {
      x += dx;
    }
    if (dy != 0.0) {
      y += dy;
    }
    return new Point2D(x, y);
  }

  /**
   * Mean of the representative points of every primitive: line endpoints, circle centers, arc centers and
   * endpoints, point positions, and spline control points.
   *
   * @param document document to inspect
   * @return centroid, or the origin when the document has no geometry
   */
  public static Point2D centroid(SketchDocument document) {
    Objects.requireNonNull(document, "document");
    double sumX = 0.0;
    double sumY = 0.0;
    long count = 0;
    for (Primitive primitive : document.primitives().values()) {
      for (Point2D point : primitive.representativePoints()) {
        sumX += point.x();
        sumY += point.y();
        count++;
      }
    }
    if (count == 0) {
      return Point2D.ORIGIN;
    }
    return new Point2D(sumX / count, sumY / count);
  }

  /**
   * Axis-aligned bounds of the document's geometry. Circles contribute their full extent; arcs contribute
   * their center and endpoints only.
   *
   * @param document document to inspect
   * @return bounds, or {@link BoundingBox#EMPTY} when the document has no geometry
   */
  public static BoundingBox bounds(SketchDocument document) {
    Objects.requireNonNull(document, "document");
    double minX = Double.POSITIVE_INFINITY;
    double minY = Double.POSITIVE_INFINITY;
    double maxX = Double.NEGATIVE_INFINITY;
    double maxY = Double.NEGATIVE_INFINITY;
    boolean any = false;
    for (Primitive primitive : document.primitives().values()) {
      List<Point2D> points;
      if (primitive instanceof Circle circle) {
        Point2D c = circle.center();
        double r = circle.radius();
        points = List.of(new Point2D(c.x() - r, c.y() - r), new Point2D(c.x() + r, c.y() + r));
      } else if (primitive instanceof Arc arc) {
        points = List.of(arc.center(), arc.startPoint(), arc.endPoint());
      } else {
        points = primitive.representativePoints();
      }
      for (Point2D p : points) {
        minX = Math.min(minX, p.x());
        minY = Math.min(minY, p.y());
        maxX = Math.max(maxX, p.x());
        maxY = Math.max(maxY, p.y());
        any = true;
      }
    }
    return any ? new BoundingBox(minX, minY, maxX, maxY) : BoundingBox.EMPTY;
  }

  private static SketchDocument apply(
      SketchDocument source, double dx, double dy, double angleDegrees, Point2D pivot, boolean stripConstraints) {
    SketchDocument copy = source.copy();
    if (stripConstraints) {
      copy.replaceConstraints(List.of());
    }
    for (Map.Entry<String, Primitive> entry : source.primitives().entrySet()) {
      copy.putPrimitive(
          entry.getKey(),
          entry.getValue().mapPoints(point -> transformPoint(point, dx, dy, angleDegrees, pivot)));
    }
    return copy;
  }
}
