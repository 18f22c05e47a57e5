package io.sketchbridge.domain.cad;

import java.util.Objects;

/**
 * Summary of a sketch living in a backend's active document, as returned by a sketch listing.
 *
 * @param name backend-side identifier used for export
 * @param label human-readable label; falls back to {@code name} when blank
 * @param geometryCount number of geometric primitives
 * @param constraintCount number of constraints
 * @since 0.1.0
 */
public record SketchInfo(String name, String label, int geometryCount, int constraintCount) {

  public SketchInfo {
    Objects.requireNonNull(name, "name");
    label = (label == null || label.isBlank()) ? name : label;
    if (geometryCount < 0 || constraintCount < 0) {
      throw new IllegalArgumentException("counts must be non-negative");
    }
  }
}
