package io.sketchbridge.domain.sketch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SketchDocumentTest {

  @Test
  void copyIsIndependentOfOriginal() {
    SketchDocument original = new SketchDocument(
        "Profile",
        Map.of("g0", new Line(new Point2D(0, 0), new Point2D(10, 0))),
        List.of(Constraint.geometric("Horizontal", "g0")),
        new SolverStatus("FullyConstrained", 0));

    SketchDocument copy = original.copy();
    assertEquals(original, copy);
    assertNotSame(original, copy);

    copy.putPrimitive("g1", new Circle(new Point2D(5, 5), 2.0));
    copy.replaceConstraints(List.of());
    copy.rename("Copy");

    assertEquals(1, original.primitives().size());
    assertEquals(1, original.constraints().size());
    assertEquals("Profile", original.name());
    assertNotEquals(original, copy);
  }

  @Test
  void preservesPrimitiveInsertionOrder() {
    SketchDocument doc = new SketchDocument("Ordered");
    doc.putPrimitive("z", new SketchPoint(new Point2D(1, 1)));
    doc.putPrimitive("a", new SketchPoint(new Point2D(2, 2)));
    assertEquals(List.of("z", "a"), List.copyOf(doc.primitives().keySet()));
  }

  @Test
  void viewsAreUnmodifiable() {
    SketchDocument doc = new SketchDocument("Locked");
    assertThrows(UnsupportedOperationException.class,
        () -> doc.primitives().put("x", new SketchPoint(Point2D.ORIGIN)));
    assertThrows(UnsupportedOperationException.class,
        () -> doc.constraints().add(Constraint.geometric("Fixed")));
  }

  @Test
  void primitivesValidateGeometry() {
    assertThrows(IllegalArgumentException.class, () -> new Circle(Point2D.ORIGIN, 0.0));
    assertThrows(IllegalArgumentException.class,
        () -> new Spline(List.of(Point2D.ORIGIN), List.of(), 3));
    assertEquals(5.0, new Line(Point2D.ORIGIN, new Point2D(3, 4)).length(), 1e-12);
    assertTrue(Constraint.dimensional("Distance", 12.5, "g0").value() == 12.5);
  }
}
