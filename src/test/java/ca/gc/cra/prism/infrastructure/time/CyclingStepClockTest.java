package ca.gc.cra.prism.infrastructure.time;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.domain.clock.ClockState;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class CyclingStepClockTest {

  @Test
  void startsAtStepOneWithoutHolds() {
    CyclingStepClock clock = new CyclingStepClock();

    assertEquals(new ClockState(1, false, false), clock.currentState());
    assertEquals(1, clock.currentStep());
  }

  @Test
  void holdPatternRepeatsEveryFourTicks() {
    CyclingStepClock clock = new CyclingStepClock();

    assertEquals(new ClockState(2, true, false), clock.advance());
    assertEquals(new ClockState(3, false, true), clock.advance());
    assertEquals(new ClockState(4, false, false), clock.advance());
    assertEquals(new ClockState(5, false, false), clock.advance());
    assertEquals(new ClockState(6, true, false), clock.advance());
  }

  @Test
  void stepWrapsAfterThirty() {
    CyclingStepClock clock = new CyclingStepClock(29);
    assertEquals(30, clock.currentStep());

    assertEquals(1, clock.advance().step());
    assertEquals(new ClockState(1, false, false), CyclingStepClock.stateAt(120));
  }

  @Test
  void rejectsNegativeStart() {
    assertThrows(IllegalArgumentException.class, () -> new CyclingStepClock(-1));
  }

  @Test
  void tickingAdvancesUntilClosed() throws Exception {
    try (CyclingStepClock clock = new CyclingStepClock()) {
      clock.startTicking(Duration.ofMillis(5));
      assertThrows(IllegalStateException.class, () -> clock.startTicking(Duration.ofMillis(5)));

      long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
      while (clock.currentStep() == 1 && System.nanoTime() < deadline) {
        Thread.sleep(5);
      }
      assertTrue(clock.currentStep() > 1);

      clock.close();
      Thread.sleep(50);
      int frozen = clock.currentStep();
      Thread.sleep(50);
      assertEquals(frozen, clock.currentStep());
    }
  }
}
