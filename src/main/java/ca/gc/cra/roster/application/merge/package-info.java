/**
 * Subsample merging: secondary tables with several rows per sample folded into multi-valued attributes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.roster.application.merge;
