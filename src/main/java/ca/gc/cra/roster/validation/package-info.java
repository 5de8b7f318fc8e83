/**
 * <strong>Purpose:</strong> Input validation for CLI arguments and export destinations.
 * <p><strong>Concurrency:</strong> Stateless utilities; thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.roster.validation;
