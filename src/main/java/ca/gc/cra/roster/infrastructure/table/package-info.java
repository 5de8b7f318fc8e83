/**
 * Delimited (CSV/TSV) sample table adapters built on opencsv.
 *
 * @since 0.1.0
 */
package ca.gc.cra.roster.infrastructure.table;
