package io.sketchbridge.domain.sketch;

import java.util.List;
import java.util.Objects;

/**
 * Geometric or dimensional constraint as carried between backends.
 *
 * <p>SketchBridge never solves constraints; it only moves them along with the document or drops them.
 * {@code references} name primitive ids, optionally with a point suffix such as {@code "L1.start"}.</p>
 *
 * @param type constraint kind (e.g., {@code coincident}, {@code distance})
 * @param references referenced primitive or point ids, in backend order
 * @param value dimensional value, or {@code null} for purely geometric constraints
 * @since 0.1.0
 */
public record Constraint(String type, List<String> references, Double value) {

  public Constraint {
    Objects.requireNonNull(type, "type");
    references = List.copyOf(Objects.requireNonNull(references, "references"));
  }

  /**
   * Creates a geometric constraint without a value.
   *
   * @param type constraint kind
   * @param references referenced ids
   * @return constraint
   */
  public static Constraint geometric(String type, String... references) {
    return new Constraint(type, List.of(references), null);
  }

  /**
   * Creates a dimensional constraint.
   *
   * @param type constraint kind
   * @param value dimension
   * @param references referenced ids
   * @return constraint
   */
  public static Constraint dimensional(String type, double value, String... references) {
    return new Constraint(type, List.of(references), value);
  }
}
