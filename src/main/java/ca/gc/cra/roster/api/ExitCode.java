package ca.gc.cra.roster.api;

/**
 * <strong>What:</strong> Process exit codes shared by the roster commands.
 * <p><strong>Why:</strong> Scripts wrapping {@code roster} tell a bad argument from a broken descriptor or an
 * unreadable table without parsing log output.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid, or named an unknown sample or amendment. */
  INVALID_ARGS(2),
  /** A sample table or export destination could not be read or written. */
  IO_ERROR(3),
  /** The project descriptor was missing or malformed, or its samples are ambiguous. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
