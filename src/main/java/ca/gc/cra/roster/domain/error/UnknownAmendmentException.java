package ca.gc.cra.roster.domain.error;

import java.util.List;

/**
 * Raised when activation names an amendment that the project does not declare.
 *
 * @since 0.1.0
 */
public final class UnknownAmendmentException extends RosterException {
  private final String amendment;
  private final List<String> declared;

  /**
   * Creates an exception listing the amendments that are available.
   *
   * @param amendment requested amendment name
   * @param declared amendments declared by the project, in declaration order
   */
  public UnknownAmendmentException(String amendment, List<String> declared) {
    super(declared.isEmpty()
        ? "Amendment '" + amendment + "' requested but the project declares no amendments"
        : "Unknown amendment '" + amendment + "'; declared: " + String.join(", ", declared));
    this.amendment = amendment;
    this.declared = List.copyOf(declared);
  }

  public String amendment() {
    return amendment;
  }

  public List<String> declared() {
    return declared;
  }
}
