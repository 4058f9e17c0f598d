/**
 * Envelope and payload model.
 * <p><strong>Role:</strong> Domain entities flowing through the pipeline: envelopes, tokens, graphs,
 * write-once stage slots, branch results and per-item errors.</p>
 * <p><strong>Concurrency:</strong> Slots and error lists are safe for concurrent writers; everything else
 * is written by the single task processing the envelope.</p>
 */
package ca.gc.cra.prism.domain.payload;
