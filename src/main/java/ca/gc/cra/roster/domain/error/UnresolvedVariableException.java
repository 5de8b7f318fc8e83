package ca.gc.cra.roster.domain.error;

import java.util.Objects;

/**
 * Raised when a {@code {name}} placeholder is provided by none of the sample, project, or environment
 * scopes.
 *
 * @since 0.1.0
 */
public final class UnresolvedVariableException extends RosterException {
  private final String variable;
  private final String template;

  /**
   * Creates an exception for a placeholder that could not be resolved.
   *
   * @param variable placeholder name without braces
   * @param template template that contained the placeholder
   */
  public UnresolvedVariableException(String variable, String template) {
    super("Unresolved variable '" + variable + "' in template: " + template);
    this.variable = Objects.requireNonNull(variable, "variable");
    this.template = Objects.requireNonNull(template, "template");
  }

  public String variable() {
    return variable;
  }

  public String template() {
    return template;
  }
}
