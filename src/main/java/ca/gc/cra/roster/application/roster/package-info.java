/**
 * <strong>Purpose:</strong> Roster resolution use cases: building a {@link ca.gc.cra.roster.application.roster.SampleRoster}
 * from a project configuration and switching amendments.
 * <p><strong>Concurrency:</strong> Builders keep per-resolution state on the stack; rosters are immutable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.roster.application.roster;
