/**
 * <strong>Purpose:</strong> Domain values describing the remote CAD systems and what they expose.
 * <p><strong>Concurrency:</strong> Immutable enums and records; safe to share across probe workers.</p>
 *
 * @since 0.1.0
 */
package io.sketchbridge.domain.cad;
