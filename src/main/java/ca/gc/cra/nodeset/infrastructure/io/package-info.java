/**
 * Record document adapters: SnakeYAML input and YAML or NDJSON (Jackson streaming) output for the CLI.
 *
 * @since 0.1.0
 */
package ca.gc.cra.nodeset.infrastructure.io;
