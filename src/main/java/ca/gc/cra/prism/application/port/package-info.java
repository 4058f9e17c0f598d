/**
 * <strong>Purpose:</strong> Ports the pipeline depends on: Reasoner, step clock, wall clock, metrics.
 * <p><strong>Pipeline role:</strong> Seams between the application layer and infrastructure adapters.</p>
 * <p><strong>Concurrency:</strong> Every port is called from multiple pipeline threads.</p>
 */
package ca.gc.cra.prism.application.port;
