package ca.gc.cra.roster.infrastructure.env;

import ca.gc.cra.roster.application.port.EnvironmentPort;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link EnvironmentPort} backed by the process environment.
 *
 * @since 0.1.0
 */
public final class SystemEnvironmentAdapter implements EnvironmentPort {

  @Override
  public Optional<String> get(String name) {
    return Optional.ofNullable(System.getenv(Objects.requireNonNull(name, "name")));
  }

  @Override
  public Map<String, String> snapshot() {
    return Map.copyOf(System.getenv());
  }
}
