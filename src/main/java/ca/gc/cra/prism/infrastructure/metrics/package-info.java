/**
 * OpenTelemetry-backed implementation of the metrics port.
 * <p>Set {@code metrics.exporter=none} (or {@code otel.metrics.exporter=none}) to run without an exporter.</p>
 */
package ca.gc.cra.prism.infrastructure.metrics;
