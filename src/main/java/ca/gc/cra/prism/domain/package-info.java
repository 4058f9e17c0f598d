/**
 * <strong>Purpose:</strong> Framework-free domain model of the staged payload pipeline.
 * <p><strong>Pipeline role:</strong> Shared vocabulary for the application layer and adapters.</p>
 * <p><strong>Concurrency:</strong> Values are immutable unless documented otherwise.</p>
 */
package ca.gc.cra.prism.domain;
