/**
 * Executor factories for the probe worker pool and the connection control thread.
 * <p><strong>Concurrency:</strong> All threads are daemons with stable names ({@code sketchbridge-probe-N},
 * {@code sketchbridge-control}) so thread dumps identify which stage is blocked on backend I/O.</p>
 */
package io.sketchbridge.infrastructure.exec;
