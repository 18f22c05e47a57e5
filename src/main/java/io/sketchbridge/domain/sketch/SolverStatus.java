package io.sketchbridge.domain.sketch;

import java.util.Objects;

/**
 * Solver state reported by the backend the document was exported from. Informational only.
 *
 * @param state solver verdict (e.g., {@code fully_constrained}, {@code under_constrained})
 * @param degreesOfFreedom remaining degrees of freedom, or {@code -1} when unknown
 * @since 0.1.0
 */
public record SolverStatus(String state, int degreesOfFreedom) {

  public SolverStatus {
    Objects.requireNonNull(state, "state");
  }
}
