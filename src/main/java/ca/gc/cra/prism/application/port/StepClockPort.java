package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.clock.ClockState;

/**
 * <strong>What:</strong> Port onto the external global step clock.
 * <p><strong>Why:</strong> Stage routing and integration gating depend on the clock step and hold flags,
 * which are owned outside the pipeline.</p>
 * <p><strong>Contract:</strong> The pipeline calls {@link #currentState()} exactly once per envelope, at
 * entry, and derives stage and gating from that snapshot. {@link #currentStep()} is read only to
 * label the exit step.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent reads.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.prism.infrastructure.time.CyclingStepClock
 */
public interface StepClockPort {
  /**
   * Returns the current step and hold flags as one consistent snapshot.
   *
   * @return clock snapshot
   */
  ClockState currentState();

  /**
   * Returns the current step without sampling hold flags.
   *
   * @return current step
   */
  int currentStep();
}
