/**
 * Metrics adapters: OpenTelemetry SDK export and a discarding fallback.
 *
 * @since 0.1.0
 */
package ca.gc.cra.roster.infrastructure.metrics;
