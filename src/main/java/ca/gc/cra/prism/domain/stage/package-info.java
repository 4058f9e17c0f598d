/**
 * Static descriptor tables and the phase router.
 * <p><strong>Role:</strong> Domain constants: the 8 Branch-A descriptors, the 3x3 Branch-B grid, and the
 * step-to-phase table.</p>
 * <p><strong>Concurrency:</strong> Immutable; safe to share across branch tasks.</p>
 */
package ca.gc.cra.prism.domain.stage;
