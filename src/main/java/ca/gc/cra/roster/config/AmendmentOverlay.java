package ca.gc.cra.roster.config;

import ca.gc.cra.roster.domain.error.UnknownAmendmentException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies named amendment (or subproject) overlays to a project configuration.
 *
 * <p>Each activation deep-merges the overlay onto a fresh copy of the base tree: mappings merge key by key,
 * scalars and lists replace. The previously active amendment, if any, plays no part.</p>
 *
 * @since 0.1.0
 */
public final class AmendmentOverlay {
  private static final Logger log = LoggerFactory.getLogger(AmendmentOverlay.class);

  private AmendmentOverlay() {}

  /**
   * Activates {@code amendment}.
   *
   * @param config any configuration of the project; only its base tree is used
   * @param amendment declared amendment name
   * @return configuration with {@code amendment} active
   * @throws UnknownAmendmentException when the project does not declare {@code amendment}
   */
  public static ProjectConfig activate(ProjectConfig config, String amendment) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(amendment, "amendment");
    Map<String, Object> body = config.overlay(amendment)
        .orElseThrow(() -> new UnknownAmendmentException(amendment, config.amendmentNames()));

    Map<String, Object> delta = new LinkedHashMap<>(body);
    delta.remove(ProjectConfig.AMENDMENTS);
    delta.remove(ProjectConfig.SUBPROJECTS);
    delta.remove(ProjectConfig.IMPORTS);

    Map<String, Object> effective = ConfigTrees.deepMerge(config.baseTree(), delta);
    log.debug("Activated amendment '{}' on {} ({} overriding keys)", amendment, config.configFile(), delta.size());
    return new ProjectConfig(config.configFile(), config.baseTree(), amendment, effective);
  }

  /**
   * Returns the base configuration with no amendment active.
   *
   * @param config any configuration of the project
   * @return base configuration
   */
  public static ProjectConfig deactivate(ProjectConfig config) {
    Objects.requireNonNull(config, "config");
    if (config.activeAmendment().isEmpty()) {
      return config;
    }
    return new ProjectConfig(config.configFile(), config.baseTree(), null, config.baseTree());
  }
}
