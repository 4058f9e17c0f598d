/**
 * Logging helpers layered over SLF4J and Logback.
 * <p><strong>Role:</strong> Truncation and redaction of logged text, plus runtime level control.</p>
 */
package ca.gc.cra.prism.logging;
