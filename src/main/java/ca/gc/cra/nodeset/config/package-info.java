/**
 * Configuration aggregates and composition root wiring for the expander CLI.
 * <p><strong>Role:</strong> Bootstrap layer merging defaults, YAML, and CLI options, then selecting adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates separators and paths; relies on {@code ca.gc.cra.nodeset.validation}
 * utilities.</p>
 */
package ca.gc.cra.nodeset.config;
