package ca.gc.cra.roster.domain.diagnostics;

import java.util.Objects;

/**
 * Structured report of a degraded condition encountered while resolving a roster.
 *
 * @param kind category of the condition; never {@code null}
 * @param sampleName affected sample; may be {@code null} for project-wide conditions
 * @param attribute affected attribute; may be {@code null}
 * @param message human-readable detail; never {@code null}
 *
 * @since 0.1.0
 */
public record Diagnostic(DiagnosticKind kind, String sampleName, String attribute, String message) {

  public Diagnostic {
    kind = Objects.requireNonNull(kind, "kind");
    message = Objects.requireNonNull(message, "message");
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(kind.name());
    if (sampleName != null) {
      sb.append(" sample=").append(sampleName);
    }
    if (attribute != null) {
      sb.append(" attribute=").append(attribute);
    }
    return sb.append(": ").append(message).toString();
  }
}
