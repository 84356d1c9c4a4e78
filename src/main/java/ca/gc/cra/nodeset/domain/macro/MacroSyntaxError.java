package ca.gc.cra.nodeset.domain.macro;

/**
 * Classifies why a property value could not be scanned or expanded.
 *
 * @since 0.1.0
 */
public enum MacroSyntaxError {
  /** A macro's parenthesis nesting never returns to zero. */
  UNCLOSED_ARGUMENT_GROUP("unclosed parentheses in macro"),
  /** A {@code )} appears before any matching {@code (}. */
  UNEXPECTED_CLOSING_PARENTHESIS("closing parenthesis before opening one"),
  /** A second top-level {@code (...)} group appears in one macro. */
  MULTIPLE_ARGUMENT_GROUPS("only one parenthesized block allowed in a macro"),
  /** A macro-function does not end with {@code $}. */
  MISSING_TERMINATING_DOLLAR("macro does not end with a dollar"),
  /** The node-range expander rejected a token. */
  INVALID_RANGE_EXPRESSION("invalid node range expression");

  private final String description;

  MacroSyntaxError(String description) {
    this.description = description;
  }

  /**
   * Returns the human-readable description used in exception messages.
   *
   * @return short description
   */
  public String description() {
    return description;
  }
}
