/**
 * <strong>Purpose:</strong> Project descriptor loading, validation and amendment overlays.
 * <p><strong>Role:</strong> Turns YAML descriptors into immutable {@link ca.gc.cra.roster.config.ProjectConfig}
 * values consumed by the roster builder.</p>
 * <p><strong>Concurrency:</strong> Loaders are stateless; configurations are immutable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.roster.config;
