package io.sketchbridge.domain.sketch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Backend-neutral 2D sketch: named primitives plus the constraints that reference them.
 * <p><strong>Why:</strong> Export from one CAD system and import into another both speak this shape.</p>
 * <p><strong>Role:</strong> Mutable domain aggregate; primitives and constraints are immutable values, so
 * {@link #copy()} only needs fresh containers to be fully independent of the source.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine an instance to one thread or copy it.</p>
 *
 * @since 0.1.0
 */
public final class SketchDocument {
  private String name;
  private final LinkedHashMap<String, Primitive> primitives;
  private final List<Constraint> constraints;
  private SolverStatus solverStatus;

  /**
   * Creates an empty document.
   *
   * @param name document name; must not be {@code null}
   */
  public SketchDocument(String name) {
    this(name, Map.of(), List.of(), null);
  }

  /**
   * Creates a document from existing content; containers are copied, insertion order is kept.
   *
   * @param name document name
   * @param primitives primitives keyed by id
   * @param constraints constraints in order
   * @param solverStatus optional solver metadata; may be {@code null}
   */
  public SketchDocument(
      String name,
      Map<String, ? extends Primitive> primitives,
      List<Constraint> constraints,
      SolverStatus solverStatus) {
    this.name = Objects.requireNonNull(name, "name");
    this.primitives = new LinkedHashMap<>(Objects.requireNonNull(primitives, "primitives"));
    this.constraints = new ArrayList<>(Objects.requireNonNull(constraints, "constraints"));
    this.solverStatus = solverStatus;
  }

  public String name() {
    return name;
  }

  public void rename(String newName) {
    this.name = Objects.requireNonNull(newName, "newName");
  }

  /**
   * Read-only view of the primitives in insertion order.
   *
   * @return unmodifiable view backed by this document
   */
  public Map<String, Primitive> primitives() {
    return Collections.unmodifiableMap(primitives);
  }

  /**
   * Looks up a primitive by id.
   *
   * @param id primitive id
   * @return the primitive when present
   */
  public Optional<Primitive> primitive(String id) {
    return Optional.ofNullable(primitives.get(id));
  }

  /**
   * Adds or replaces a primitive. Replacing keeps the original insertion position.
   *
   * @param id primitive id; must not be {@code null}
   * @param primitive primitive; must not be {@code null}
   */
  public void putPrimitive(String id, Primitive primitive) {
    primitives.put(Objects.requireNonNull(id, "id"), Objects.requireNonNull(primitive, "primitive"));
  }

  public Optional<Primitive> removePrimitive(String id) {
    return Optional.ofNullable(primitives.remove(id));
  }

  /**
   * Read-only view of the constraints in order.
   *
   * @return unmodifiable view backed by this document
   */
  public List<Constraint> constraints() {
    return Collections.unmodifiableList(constraints);
  }

  public void addConstraint(Constraint constraint) {
    constraints.add(Objects.requireNonNull(constraint, "constraint"));
  }

  /**
   * Replaces every constraint.
   *
   * @param replacement new constraints; an empty list removes them all
   */
  public void replaceConstraints(List<Constraint> replacement) {
    Objects.requireNonNull(replacement, "replacement");
    constraints.clear();
    constraints.addAll(replacement);
  }

  public Optional<SolverStatus> solverStatus() {
    return Optional.ofNullable(solverStatus);
  }

  public void setSolverStatus(SolverStatus solverStatus) {
    this.solverStatus = solverStatus;
  }

  /**
   * Deep copy: new containers holding the same immutable primitives and constraints.
   *
   * @return independent document equal to this one
   */
  public SketchDocument copy() {
    return new SketchDocument(name, primitives, constraints, solverStatus);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SketchDocument other)) {
      return false;
    }
    return name.equals(other.name)
        && primitives.equals(other.primitives)
        && List.copyOf(primitives.keySet()).equals(List.copyOf(other.primitives.keySet()))
        && constraints.equals(other.constraints)
        && Objects.equals(solverStatus, other.solverStatus);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, primitives, constraints, solverStatus);
  }

  @Override
  public String toString() {
    return "SketchDocument{name=" + name
        + ", primitives=" + primitives.size()
        + ", constraints=" + constraints.size() + '}';
  }
}
