package ca.gc.cra.nodeset.api;

/**
 * <strong>What:</strong> Process exit codes shared by the expander commands.
 * <p><strong>Why:</strong> Lets scripts tell bad arguments apart from malformed macros and I/O failures.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Reading the record document or writing the result failed. */
  IO_ERROR(3),
  /** A record held a malformed macro, range, or document structure. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value reported to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
