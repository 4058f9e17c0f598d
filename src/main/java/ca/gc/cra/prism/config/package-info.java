/**
 * Configuration loading and adapter wiring.
 * <p><strong>Role:</strong> Turns YAML or key/value maps into a validated
 * {@link ca.gc.cra.prism.config.PipelineConfig} and composes the production adapters around the
 * pipeline controller.</p>
 */
package ca.gc.cra.prism.config;
