/**
 * Placeholder substitution and wildcard expansion for path templates.
 *
 * @since 0.1.0
 */
package ca.gc.cra.roster.application.substitution;
