/**
 * Attribute modifier pipeline: append, duplicate, derive, imply and remove, applied per sample in that order.
 *
 * @since 0.1.0
 */
package ca.gc.cra.roster.application.modifier;
