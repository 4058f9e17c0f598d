package ca.gc.cra.prism.infrastructure.time;

import ca.gc.cra.prism.application.port.StepClockPort;
import ca.gc.cra.prism.domain.clock.ClockState;
import ca.gc.cra.prism.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> In-process {@link StepClockPort} cycling through steps {@code 1..30} with a
 * four-tick hold pattern.
 * <p><strong>Why:</strong> Hosts without an external global clock still need step-based routing and
 * gating; this adapter drives both from a single tick counter.</p>
 * <p><strong>Hold pattern:</strong> ticks cycle through four positions; the second holds Branch-A, the
 * third holds Branch-B, the first and fourth hold nothing.</p>
 * <p><strong>Thread-safety:</strong> Snapshots are derived from one atomic read of the tick counter, so step
 * and flags are always consistent.</p>
 *
 * @since 0.1.0
 */
public final class CyclingStepClock implements StepClockPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CyclingStepClock.class);
  public static final int CYCLE_LENGTH = 30;
  public static final int HOLD_PATTERN_LENGTH = 4;

  private final AtomicLong ticks;
  private volatile ScheduledExecutorService scheduler;

  public CyclingStepClock() {
    this(0L);
  }

  /**
   * Creates a clock positioned at {@code initialTick}.
   *
   * @param initialTick non-negative tick count; tick 0 reports step 1 with no hold
   */
  public CyclingStepClock(long initialTick) {
    if (initialTick < 0) {
      throw new IllegalArgumentException("initialTick must be non-negative");
    }
    this.ticks = new AtomicLong(initialTick);
  }

  @Override
  public ClockState currentState() {
    return stateAt(ticks.get());
  }

  @Override
  public int currentStep() {
    return stepAt(ticks.get());
  }

  /**
   * Advances the clock by one tick.
   *
   * @return snapshot after the advance
   */
  public ClockState advance() {
    return stateAt(ticks.incrementAndGet());
  }

  /**
   * Starts advancing automatically every {@code interval} on a daemon thread.
   *
   * @param interval tick period; must be positive
   * @throws IllegalStateException if ticking was already started
   */
  public synchronized void startTicking(Duration interval) {
    Objects.requireNonNull(interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    if (scheduler != null) {
      throw new IllegalStateException("clock already ticking");
    }
    ScheduledExecutorService executor = ExecutorFactories.newDaemonScheduler(
        "prism-clock", (thread, ex) -> log.error("Step clock tick failed on {}", thread.getName(), ex));
    long nanos = interval.toNanos();
    executor.scheduleAtFixedRate(this::advance, nanos, nanos, TimeUnit.NANOSECONDS);
    scheduler = executor;
    log.info("Step clock ticking every {} ms", interval.toMillis());
  }

  @Override
  public synchronized void close() {
    ScheduledExecutorService executor = scheduler;
    if (executor != null) {
      executor.shutdownNow();
      scheduler = null;
    }
  }

  static ClockState stateAt(long tick) {
    int position = (int) (tick % HOLD_PATTERN_LENGTH);
    return new ClockState(stepAt(tick), position == 1, position == 2);
  }

  private static int stepAt(long tick) {
    return (int) (tick % CYCLE_LENGTH) + 1;
  }
}
