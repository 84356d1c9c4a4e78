/**
 * <strong>Purpose:</strong> Command-line adapters for expanding record documents and scanning values.
 * <p><strong>Pipeline role:</strong> Outer surface; parses {@code key=value} arguments, merges YAML
 * configuration, and hands records to {@link ca.gc.cra.nodeset.application.expand.ExpansionPipeline}.</p>
 * <p><strong>Error handling:</strong> Failures map to {@link ca.gc.cra.nodeset.api.ExitCode} values.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.nodeset.api;
