/**
 * <strong>Purpose:</strong> Command-line driving adapter: the {@code sketchbridge} dispatcher and its
 * {@code status} and {@code monitor} commands.
 * <p><strong>Exit codes:</strong> See {@link io.sketchbridge.api.ExitCode}.</p>
 *
 * @since 0.1.0
 */
package io.sketchbridge.api;
