package ca.gc.cra.roster.domain.error;

/**
 * Raised when a project descriptor cannot be read, parsed, or validated.
 *
 * <p>Covers missing files, malformed YAML, import cycles, a missing
 * {@code metadata.sample_annotation} entry, and malformed {@code sample_modifiers}. Always fatal.</p>
 *
 * @since 0.1.0
 */
public final class ConfigLoadException extends RosterException {
  public ConfigLoadException(String message) {
    super(message);
  }

  public ConfigLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
