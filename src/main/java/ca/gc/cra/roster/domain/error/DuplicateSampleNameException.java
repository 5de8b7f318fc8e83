package ca.gc.cra.roster.domain.error;

import java.util.List;

/**
 * Raised at build time when two or more samples share a {@code sample_name}.
 *
 * <p>Ambiguous identities are never collapsed into a single record.</p>
 *
 * @since 0.1.0
 */
public final class DuplicateSampleNameException extends RosterException {
  private final List<String> duplicates;

  /**
   * Creates an exception naming every duplicated sample name.
   *
   * @param duplicates duplicated names in first-seen order
   */
  public DuplicateSampleNameException(List<String> duplicates) {
    super("Found " + duplicates.size() + " non-unique sample name(s): " + String.join(", ", duplicates));
    this.duplicates = List.copyOf(duplicates);
  }

  public List<String> duplicates() {
    return duplicates;
  }
}
