package ca.gc.cra.roster.application.substitution;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tiered namespace consulted when expanding {@code {name}} placeholders: sample first, then project, then
 * environment.
 *
 * @param sample sample attributes (joined values)
 * @param project top-level scalars of the project configuration
 * @param environment environment variables
 *
 * @since 0.1.0
 */
public record ExpansionScope(Map<String, String> sample, Map<String, String> project, Map<String, String> environment) {

  public ExpansionScope {
    sample = sample == null ? Map.of() : Map.copyOf(sample);
    project = project == null ? Map.of() : Map.copyOf(project);
    environment = environment == null ? Map.of() : Map.copyOf(environment);
  }

  /**
   * Scope without sample attributes, used for project-level paths.
   *
   * @param project project scalars
   * @param environment environment variables
   * @return scope with an empty sample tier
   */
  public static ExpansionScope projectOnly(Map<String, String> project, Map<String, String> environment) {
    return new ExpansionScope(Map.of(), project, environment);
  }

  /**
   * Resolves a placeholder name against the tiers in priority order.
   *
   * @param name placeholder name
   * @return value from the highest-priority tier defining {@code name}
   */
  public Optional<String> lookup(String name) {
    String value = sample.get(name);
    if (value == null) {
      value = project.get(name);
    }
    if (value == null) {
      value = environment.get(name);
    }
    return Optional.ofNullable(value);
  }

  /**
   * Layers values over the sample tier, e.g. the cells of a contributing subsample row.
   *
   * @param overrides values that win over the current sample tier
   * @return new scope
   */
  public ExpansionScope withPriority(Map<String, String> overrides) {
    Map<String, String> layered = new LinkedHashMap<>(sample);
    layered.putAll(overrides);
    return new ExpansionScope(layered, project, environment);
  }
}
