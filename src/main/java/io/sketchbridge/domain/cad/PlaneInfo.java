package io.sketchbridge.domain.cad;

import java.util.List;
import java.util.Objects;

/**
 * A plane a backend can host a new sketch on.
 *
 * @param id backend identifier passed back on import (e.g., {@code XY})
 * @param name display name; falls back to {@code id} when blank
 * @param type plane kind reported by the backend (e.g., {@code origin}); may be empty
 * @since 0.1.0
 */
public record PlaneInfo(String id, String name, String type) {

  /** Principal planes offered when a backend cannot report its own. */
  public static final List<PlaneInfo> PRINCIPAL_PLANES = List.of(
      new PlaneInfo("XY", "XY Plane", ""),
      new PlaneInfo("XZ", "XZ Plane", ""),
      new PlaneInfo("YZ", "YZ Plane", ""));

  public PlaneInfo {
    Objects.requireNonNull(id, "id");
    name = (name == null || name.isBlank()) ? id : name;
    type = type == null ? "" : type;
  }

  /**
   * Label combining name and type, such as {@code "Front (origin)"}.
   *
   * @return display label
   */
  public String displayLabel() {
    return type.isBlank() ? name : name + " (" + type + ")";
  }
}
