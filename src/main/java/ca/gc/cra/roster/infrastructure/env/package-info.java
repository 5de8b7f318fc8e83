/**
 * Process environment adapter.
 *
 * @since 0.1.0
 */
package ca.gc.cra.roster.infrastructure.env;
