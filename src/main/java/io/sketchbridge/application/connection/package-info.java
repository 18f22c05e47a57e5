/**
 * <strong>Purpose:</strong> Connection Manager: session lifecycle, periodic liveness probing and change
 * notification for the CAD backends.
 * <p><strong>Concurrency:</strong> Ticks and result reconciliation run on one control thread; probes run wherever
 * the {@link io.sketchbridge.application.connection.ProbeStrategy} puts them. Record writes are serialized per
 * backend.</p>
 *
 * @since 0.1.0
 */
package io.sketchbridge.application.connection;
