/**
 * <strong>Purpose:</strong> Ports between the SketchBridge core and its collaborators: backend RPC adapters,
 * notification consumers, user selection, and metrics.
 * <p><strong>Pipeline role:</strong> Application layer; adapters implement these interfaces to integrate external
 * systems.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package io.sketchbridge.application.port;
