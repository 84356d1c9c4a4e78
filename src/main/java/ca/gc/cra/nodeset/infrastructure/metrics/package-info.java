/**
 * <strong>Purpose:</strong> Metrics adapters implementing {@link ca.gc.cra.nodeset.application.port.MetricsPort}.
 * <p><strong>Observability:</strong> OpenTelemetry SDK with an OTLP exporter, or a no-op adapter.
 *
 * @since 0.1.0
 */
package ca.gc.cra.nodeset.infrastructure.metrics;
