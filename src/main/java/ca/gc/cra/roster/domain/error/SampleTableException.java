package ca.gc.cra.roster.domain.error;

/**
 * Raised when a sample or subsample table cannot be read or lacks the columns needed to identify
 * samples.
 *
 * @since 0.1.0
 */
public final class SampleTableException extends RosterException {
  public SampleTableException(String message) {
    super(message);
  }

  public SampleTableException(String message, Throwable cause) {
    super(message, cause);
  }
}
