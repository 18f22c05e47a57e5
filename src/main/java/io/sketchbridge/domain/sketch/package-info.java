/**
 * <strong>Purpose:</strong> Backend-neutral sketch model: documents, primitives, constraints.
 * <p><strong>Pipeline role:</strong> Payload exported from one backend, transformed, and imported into another.</p>
 * <p><strong>Concurrency:</strong> Primitives are immutable records; {@link io.sketchbridge.domain.sketch.SketchDocument}
 * is a mutable aggregate and must be copied before being handed across threads.</p>
 *
 * @since 0.1.0
 */
package io.sketchbridge.domain.sketch;
