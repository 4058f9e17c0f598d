/**
 * Staged fan-out/fan-in payload pipeline.
 * <p>Envelopes carrying tokens, graphs or batches are routed by a global step clock, fanned out to two
 * parallel branch stages of Reasoner calls, folded once per payload, and emitted on a bounded queue.</p>
 */
package ca.gc.cra.prism;
