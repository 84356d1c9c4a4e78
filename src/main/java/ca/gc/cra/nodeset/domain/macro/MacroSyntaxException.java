package ca.gc.cra.nodeset.domain.macro;

import java.util.Objects;

/**
 * <strong>What:</strong> Fatal syntax failure raised while scanning or expanding a property value.
 * <p><strong>Why:</strong> Lets configuration loaders branch on {@link #error()} instead of parsing messages.</p>
 * <p><strong>Role:</strong> Domain exception propagated unchanged through the expansion pipeline.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 */
public final class MacroSyntaxException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final MacroSyntaxError error;
  private final String offendingText;

  /**
   * Creates an exception for the given error kind and offending text.
   *
   * @param error error classification; must not be {@code null}
   * @param offendingText substring (or whole value) that triggered the failure
   */
  public MacroSyntaxException(MacroSyntaxError error, String offendingText) {
    this(error, offendingText, null);
  }

  /**
   * Creates an exception that wraps a collaborator failure.
   *
   * @param error error classification; must not be {@code null}
   * @param offendingText substring (or whole value) that triggered the failure
   * @param cause underlying failure, e.g. a node-range parse error
   */
  public MacroSyntaxException(MacroSyntaxError error, String offendingText, Throwable cause) {
    super(Objects.requireNonNull(error, "error").description() + " at: " + offendingText, cause);
    this.error = error;
    this.offendingText = offendingText == null ? "" : offendingText;
  }

  public MacroSyntaxError error() {
    return error;
  }

  public String offendingText() {
    return offendingText;
  }
}
