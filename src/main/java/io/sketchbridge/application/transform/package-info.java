/**
 * Geometry transform pipeline: translate and rotate sketch copies, optionally stripping constraints.
 *
 * @since 0.1.0
 */
package io.sketchbridge.application.transform;
