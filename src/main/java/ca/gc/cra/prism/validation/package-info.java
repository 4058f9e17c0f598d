/**
 * Validation helpers for configuration values.
 * <p><strong>Role:</strong> Fail fast with {@link java.lang.IllegalArgumentException} before queues, pools
 * or HTTP clients are built.</p>
 */
package ca.gc.cra.prism.validation;
