package ca.gc.cra.roster.domain.error;

/**
 * Raised by roster queries for a sample name that the roster does not contain.
 *
 * @since 0.1.0
 */
public final class SampleNotFoundException extends RosterException {
  private final String sampleName;

  public SampleNotFoundException(String sampleName) {
    super("Project has no sample named " + sampleName);
    this.sampleName = sampleName;
  }

  public String sampleName() {
    return sampleName;
  }
}
