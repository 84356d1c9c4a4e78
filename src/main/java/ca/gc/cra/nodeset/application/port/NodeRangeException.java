package ca.gc.cra.nodeset.application.port;

/**
 * Checked exception thrown when a node-range token cannot be parsed.
 *
 * @since 0.1.0
 */
public final class NodeRangeException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public NodeRangeException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause, e.g. a numeric parse failure
   */
  public NodeRangeException(String msg, Throwable cause) { super(msg, cause); }
}
