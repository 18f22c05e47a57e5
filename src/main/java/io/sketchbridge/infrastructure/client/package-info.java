/**
 * <strong>Purpose:</strong> Adapter plumbing around the per-backend RPC clients: lazy construction, a disabled
 * placeholder, and {@link java.util.ServiceLoader} discovery.
 *
 * @since 0.1.0
 */
package io.sketchbridge.infrastructure.client;
