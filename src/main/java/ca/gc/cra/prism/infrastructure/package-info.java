/**
 * <strong>Purpose:</strong> Adapters implementing the application ports.
 * <p><strong>Role:</strong> HTTP Reasoner client, OpenTelemetry metrics, clocks and executors.</p>
 */
package ca.gc.cra.prism.infrastructure;
