package io.sketchbridge.application.transfer;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of collecting sketches from one backend.
 *
 * @param outcome what happened
 * @param sketches successfully exported sketches in selection order
 * @since 0.1.0
 */
public record CollectResult(Outcome outcome, List<CollectedSketch> sketches) {

  /** Collection outcomes. */
  public enum Outcome {
    /** The backend listed no sketches (or could not be listed); nothing was exported. */
    NO_SKETCHES,
    /** Several sketches were offered and none was selected; nothing was exported. */
    NOTHING_SELECTED,
    /** At least one selected sketch was exported. */
    COLLECTED,
    /** Every selected sketch failed to export. */
    FAILED
  }

  public CollectResult {
    Objects.requireNonNull(outcome, "outcome");
    sketches = sketches == null ? List.of() : List.copyOf(sketches);
  }

  static CollectResult of(Outcome outcome) {
    return new CollectResult(outcome, List.of());
  }

  /**
   * Number of sketches exported successfully.
   *
   * @return success count
   */
  public int count() {
    return sketches.size();
  }
}
