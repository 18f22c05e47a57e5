/**
 * Transfer Orchestrator: collect sketches from one backend, deliver them (optionally transformed) to another.
 */
package io.sketchbridge.application.transfer;
