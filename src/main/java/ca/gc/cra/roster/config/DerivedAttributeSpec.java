package ca.gc.cra.roster.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Declares an attribute whose raw value names a data source; the value is replaced by the source's
 * expanded template.
 *
 * @param attribute attribute to derive
 * @param sources data source key to path template
 *
 * @since 0.1.0
 */
public record DerivedAttributeSpec(String attribute, Map<String, String> sources) {

  public DerivedAttributeSpec {
    attribute = Objects.requireNonNull(attribute, "attribute");
    sources = sources == null ? Map.of() : Map.copyOf(sources);
  }

  /**
   * Looks up the template a raw value token refers to.
   *
   * @param sourceKey raw attribute token
   * @return template when {@code sourceKey} names a declared source
   */
  public Optional<String> templateFor(String sourceKey) {
    return Optional.ofNullable(sources.get(sourceKey));
  }
}
