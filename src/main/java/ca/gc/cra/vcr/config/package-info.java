/**
 * Recorder configuration and composition root.
 * <p><strong>Role:</strong> Bootstrap layer resolving defaults, YAML profiles, and overrides into
 * {@link ca.gc.cra.vcr.config.RecorderConfig}, then wiring adapters into recorders.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> YAML is parsed with SnakeYAML's safe constructor.</p>
 */
package ca.gc.cra.vcr.config;
