/**
 * <strong>Purpose:</strong> Ports between the resolution core and its environment.
 * <p><strong>Role:</strong> Tables, environment variables, filesystem globbing and metrics are reached only
 * through these interfaces; adapters live under {@code ca.gc.cra.roster.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> Implementations must be safe to share between independent resolutions.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.roster.application.port;
