/**
 * <strong>Purpose:</strong> Ports the expansion core depends on: node-range enumeration and metrics.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.
 * <p><strong>Security:</strong> Range expanders must bound their output so hostile values cannot exhaust memory.
 *
 * @since 0.1.0
 */
package ca.gc.cra.nodeset.application.port;
