package io.sketchbridge.application.transfer;

import io.sketchbridge.domain.sketch.SketchDocument;
import java.util.Objects;

/**
 * A sketch exported from a backend and held in the local workspace.
 *
 * @param key workspace key of the form {@code <backend>_<n>_<document name>}
 * @param source display name of the backend it came from
 * @param document exported document
 * @since 0.1.0
 */
public record CollectedSketch(String key, String source, SketchDocument document) {

  public CollectedSketch {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(document, "document");
  }
}
