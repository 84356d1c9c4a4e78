/**
 * <strong>Purpose:</strong> Macro expansion core: the EXPAND substitution pass, DUPLICATE cloning, and the
 * pipeline that chains them.
 * <p><strong>Pipeline role:</strong> Application layer between the configuration reader and the object model.
 * <p><strong>Concurrency:</strong> Services are immutable; per-call state lives in {@code CloneSet}.
 * <p><strong>Observability:</strong> SLF4J logging plus counters through {@code MetricsPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.nodeset.application.expand;
