/**
 * Node-range adapters implementing {@link ca.gc.cra.nodeset.application.port.NodeRangeExpander}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.nodeset.infrastructure.range;
