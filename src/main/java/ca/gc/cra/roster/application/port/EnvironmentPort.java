package ca.gc.cra.roster.application.port;

import java.util.Map;
import java.util.Optional;

/**
 * Port supplying the environment scope, the lowest-priority namespace for {@code {name}} placeholders.
 *
 * @since 0.1.0
 */
public interface EnvironmentPort {
  /**
   * Looks up a single variable.
   *
   * @param name variable name
   * @return value when defined
   */
  Optional<String> get(String name);

  /**
   * Returns an immutable snapshot of every variable, taken once per resolution.
   *
   * @return variable name to value
   */
  Map<String, String> snapshot();

  /**
   * Creates a fixed environment, mainly for tests and embedding callers.
   *
   * @param variables variables to expose
   * @return environment backed by a copy of {@code variables}
   */
  static EnvironmentPort of(Map<String, String> variables) {
    Map<String, String> copy = Map.copyOf(variables);
    return new EnvironmentPort() {
      @Override
      public Optional<String> get(String name) {
        return Optional.ofNullable(copy.get(name));
      }

      @Override
      public Map<String, String> snapshot() {
        return copy;
      }
    };
  }
}
