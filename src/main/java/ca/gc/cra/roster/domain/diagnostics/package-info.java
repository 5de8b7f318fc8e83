/**
 * Structured diagnostics channel for non-fatal resolution problems.
 * <p>Diagnostics are attached to the resolved roster and mirrored to SLF4J warnings; they never
 * replace exceptions for structural failures.</p>
 */
package ca.gc.cra.roster.domain.diagnostics;
