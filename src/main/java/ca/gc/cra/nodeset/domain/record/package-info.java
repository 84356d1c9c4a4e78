/**
 * Multi-valued configuration records exchanged with the configuration loader.
 *
 * @since 0.1.0
 */
package ca.gc.cra.nodeset.domain.record;
