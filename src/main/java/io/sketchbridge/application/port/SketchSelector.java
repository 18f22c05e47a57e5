package io.sketchbridge.application.port;

import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.domain.cad.SketchInfo;
import java.util.List;

/**
 * Driving-side callback that lets a user pick which sketches to collect when a backend offers several.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SketchSelector {

  /**
   * Chooses sketches to collect.
   *
   * @param backend backend being collected from
   * @param available sketches offered by the backend (two or more)
   * @return chosen subset; empty when the user cancels or selects nothing
   */
  List<SketchInfo> select(Backend backend, List<SketchInfo> available);

  /** Selects every offered sketch. */
  SketchSelector ALL = (backend, available) -> available;

  /** Selects nothing, as when a selection dialog is cancelled. */
  SketchSelector NONE = (backend, available) -> List.of();
}
