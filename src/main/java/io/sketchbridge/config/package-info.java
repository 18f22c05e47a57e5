/**
 * <strong>Purpose:</strong> Configuration loading (defaults, YAML, CLI), the typed {@link
 * io.sketchbridge.config.BridgeConfig} view, and the composition root.
 * <p><strong>Precedence:</strong> CLI &gt; YAML &gt; defaults.</p>
 *
 * @since 0.1.0
 */
package io.sketchbridge.config;
