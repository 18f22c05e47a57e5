/**
 * Connection notification listeners that publish to logs and metrics.
 */
package io.sketchbridge.infrastructure.events;
