package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.application.port.StepClockPort;
import ca.gc.cra.prism.domain.clock.ClockState;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Step clock double returning a fixed snapshot and counting reads.
 */
final class FixedStepClock implements StepClockPort {
  private volatile ClockState state;
  private final AtomicInteger stateReads = new AtomicInteger();

  FixedStepClock(int step, boolean holdA, boolean holdB) {
    this.state = new ClockState(step, holdA, holdB);
  }

  void set(ClockState next) {
    this.state = next;
  }

  @Override
  public ClockState currentState() {
    stateReads.incrementAndGet();
    return state;
  }

  @Override
  public int currentStep() {
    return state.step();
  }

  int stateReads() {
    return stateReads.get();
  }
}
