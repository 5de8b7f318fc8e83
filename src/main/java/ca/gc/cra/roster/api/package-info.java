/**
 * <strong>Purpose:</strong> Command-line entry points: {@code roster inspect}, {@code roster sample} and
 * {@code roster export}.
 * <p><strong>Role:</strong> Adapter layer translating {@code key=value} arguments into resolver calls and
 * resolution failures into {@link ca.gc.cra.roster.api.ExitCode}s.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.roster.api;
