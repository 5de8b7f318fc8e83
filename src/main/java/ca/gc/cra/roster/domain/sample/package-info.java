/**
 * Sample model: resolved records, working drafts, subsample rows and the tabular export.
 * <p><strong>Role:</strong> Domain layer; no dependencies on configuration or infrastructure.</p>
 * <p><strong>Concurrency:</strong> {@code SampleRecord}, {@code SubsampleRow} and {@code SampleTable}
 * are immutable; {@code SampleDraft} is confined to one resolution.</p>
 */
package ca.gc.cra.roster.domain.sample;
