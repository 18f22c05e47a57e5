/**
 * <strong>Purpose:</strong> Input validators shared by configuration loading, the CLI, and domain value constructors.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.</p>
 * <p><strong>Security:</strong> Reject control characters and malformed endpoints before they reach an RPC adapter.</p>
 *
 * @since 0.1.0
 */
package io.sketchbridge.validation;
