/**
 * <strong>Purpose:</strong> Macro token model, scanner, and range-aware argument splitting.
 * <p><strong>Concurrency:</strong> Stateless utilities and immutable records.
 * <p><strong>Observability:</strong> No logging; failures raise {@link ca.gc.cra.nodeset.domain.macro.MacroSyntaxException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.nodeset.domain.macro;
