/**
 * Metrics adapters bridging {@link io.sketchbridge.application.port.MetricsPort} to OpenTelemetry or to nothing.
 * <p><strong>Metrics:</strong> Publishes under the {@code probe.*}, {@code connection.*} and {@code transfer.*}
 * namespaces.</p>
 */
package io.sketchbridge.infrastructure.metrics;
