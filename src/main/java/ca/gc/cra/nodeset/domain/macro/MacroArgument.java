package ca.gc.cra.nodeset.domain.macro;

/**
 * Raw argument group of a macro-function.
 *
 * @param text characters between the top-level parentheses, unparsed
 * @param openIndex index of the opening parenthesis in the scanned text
 * @param closeIndex index of the matching closing parenthesis in the scanned text
 * @since 0.1.0
 */
public record MacroArgument(String text, int openIndex, int closeIndex) {}
