/**
 * Step clock value types.
 * <p><strong>Role:</strong> Immutable snapshots exchanged between the step clock port and the pipeline.</p>
 */
package ca.gc.cra.prism.domain.clock;
