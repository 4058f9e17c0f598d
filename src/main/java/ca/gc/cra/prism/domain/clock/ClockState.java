package ca.gc.cra.prism.domain.clock;

/**
 * <strong>What:</strong> Snapshot of the global step clock.
 * <p><strong>Role:</strong> Returned by {@code StepClockPort.currentState()} and stored on the envelope
 * as its entry snapshot.</p>
 * <p><strong>Thread-safety:</strong> Immutable value.</p>
 *
 * @param step current clock step (the cycling clock reports {@code 1..30})
 * @param holdA Branch-A hold flag
 * @param holdB Branch-B hold flag
 * @since 0.1.0
 */
public record ClockState(int step, boolean holdA, boolean holdB) {

  /**
   * Returns the gating flags of this snapshot.
   *
   * @return gating state carrying {@link #holdA()} and {@link #holdB()}
   */
  public GatingState gating() {
    return new GatingState(holdA, holdB);
  }
}
