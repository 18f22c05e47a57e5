/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep backend-supplied text log-safe.
 * <p><strong>Concurrency:</strong> Stateless helpers.</p>
 *
 * @since 0.1.0
 */
package io.sketchbridge.logging;
