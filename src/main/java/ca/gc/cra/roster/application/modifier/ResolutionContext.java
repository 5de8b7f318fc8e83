package ca.gc.cra.roster.application.modifier;

import ca.gc.cra.roster.application.substitution.ExpansionScope;
import ca.gc.cra.roster.domain.diagnostics.DiagnosticsCollector;
import ca.gc.cra.roster.domain.sample.SampleDraft;
import java.util.Map;
import java.util.Objects;

/**
 * Per-resolution state shared by the modifier stages.
 *
 * @param projectScope top-level scalars of the effective configuration
 * @param environment environment snapshot taken at the start of the resolution
 * @param diagnostics sink for non-fatal conditions
 *
 * @since 0.1.0
 */
public record ResolutionContext(
    Map<String, String> projectScope, Map<String, String> environment, DiagnosticsCollector diagnostics) {

  public ResolutionContext {
    projectScope = Map.copyOf(Objects.requireNonNull(projectScope, "projectScope"));
    environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
    diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  /**
   * Builds the expansion scope for a sample from its current values.
   *
   * @param sample sample under resolution
   * @return scope with the sample's joined attributes as top tier
   */
  public ExpansionScope scopeFor(SampleDraft sample) {
    return new ExpansionScope(sample.scope(), projectScope, environment);
  }
}
