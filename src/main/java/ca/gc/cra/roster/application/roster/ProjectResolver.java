package ca.gc.cra.roster.application.roster;

import ca.gc.cra.roster.config.ProjectConfig;
import ca.gc.cra.roster.config.ProjectConfigLoader;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Facade combining descriptor loading, amendment activation and roster building.
 *
 * <p>Activation never mutates an existing roster: a failed activation (for example an undeclared amendment)
 * throws before any rebuild, and the caller keeps its previous roster.</p>
 *
 * @since 0.1.0
 */
public final class ProjectResolver {
  private static final Logger log = LoggerFactory.getLogger(ProjectResolver.class);

  private final ProjectConfigLoader loader;
  private final RosterBuilder builder;

  public ProjectResolver(ProjectConfigLoader loader, RosterBuilder builder) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.builder = Objects.requireNonNull(builder, "builder");
  }

  public ProjectConfig load(Path configFile) {
    return loader.load(configFile);
  }

  /**
   * Loads a descriptor and resolves its base configuration.
   *
   * @param configFile descriptor location
   * @return resolved roster
   */
  public SampleRoster resolve(Path configFile) {
    return resolve(loader.load(configFile));
  }

  /**
   * Loads a descriptor and resolves it with an amendment active.
   *
   * @param configFile descriptor location
   * @param amendment amendment to activate; {@code null} resolves the base configuration
   * @return resolved roster
   * @throws ca.gc.cra.roster.domain.error.UnknownAmendmentException when the amendment is not declared
   */
  public SampleRoster resolve(Path configFile, String amendment) {
    ProjectConfig config = loader.load(configFile);
    return resolve(amendment == null ? config : config.activate(amendment));
  }

  public SampleRoster resolve(ProjectConfig config) {
    return builder.build(config);
  }

  /**
   * Rebuilds a roster with {@code amendment} active, computed from the base configuration.
   *
   * @param roster current roster; left untouched
   * @param amendment amendment to activate
   * @return new roster
   * @throws ca.gc.cra.roster.domain.error.UnknownAmendmentException when the amendment is not declared
   */
  public SampleRoster activate(SampleRoster roster, String amendment) {
    ProjectConfig activated = roster.config().activate(amendment);
    log.info("Activating amendment '{}' for project '{}'", amendment, activated.name());
    return builder.build(activated);
  }

  /**
   * Rebuilds a roster from the base configuration.
   *
   * @param roster current roster; left untouched
   * @return roster with no amendment active
   */
  public SampleRoster deactivate(SampleRoster roster) {
    return builder.build(roster.config().deactivate());
  }
}
