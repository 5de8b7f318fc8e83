package ca.gc.cra.roster.domain.error;

/**
 * Base type for failures raised while loading a project or resolving its sample roster.
 *
 * <p>Subclasses separate structural failures, which abort a resolution, from failures scoped to a
 * single attribute or query.</p>
 *
 * @since 0.1.0
 */
public abstract class RosterException extends RuntimeException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  protected RosterException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause, typically an {@link java.io.IOException} or parser failure
   */
  protected RosterException(String message, Throwable cause) {
    super(message, cause);
  }
}
