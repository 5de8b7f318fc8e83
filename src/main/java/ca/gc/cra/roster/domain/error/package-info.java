/**
 * Exception hierarchy for project loading, roster resolution, and roster queries.
 * <p><strong>Role:</strong> Domain layer; every type extends {@link ca.gc.cra.roster.domain.error.RosterException}.</p>
 * <p><strong>Fatal:</strong> {@code ConfigLoadException}, {@code SampleTableException},
 * {@code DuplicateSampleNameException}, {@code UnknownAmendmentException}.</p>
 * <p><strong>Scoped:</strong> {@code UnresolvedVariableException} degrades a single attribute;
 * {@code SampleNotFoundException} fails a single query.</p>
 */
package ca.gc.cra.roster.domain.error;
