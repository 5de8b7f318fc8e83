/**
 * <strong>Purpose:</strong> Adapters implementing the application ports against the filesystem, the process
 * environment and OpenTelemetry.
 *
 * @since 0.1.0
 */
package ca.gc.cra.roster.infrastructure;
