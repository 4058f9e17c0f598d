package ca.gc.cra.prism.domain.payload;

import ca.gc.cra.prism.domain.stage.Perspective;
import ca.gc.cra.prism.domain.stage.TemporalScope;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <strong>What:</strong> Common base of the two work-item types: {@link Token} and {@link Graph}.
 * <p><strong>Why:</strong> Both carry the same processing scratch space: two stage slot arrays, one
 * optional integrated result, and a state.</p>
 * <p><strong>Role:</strong> Domain entity owned by exactly one envelope while in flight.</p>
 * <p><strong>Thread-safety:</strong> Slots are write-once and thread-safe; the integrated result is set
 * at most once; state is volatile. A payload is processed once: {@link #claim()} guards
 * resubmission.</p>
 *
 * @since 0.1.0
 */
public abstract sealed class Payload permits Token, Graph {
  private final String id;
  private final long createdAtMillis;
  private final StageSlots<PerspectiveResult> branchA = new StageSlots<>("branchA", Perspective.WIDTH);
  private final StageSlots<TemporalScopeResult> branchB =
      new StageSlots<>("branchB", TemporalScope.WIDTH);
  private final AtomicReference<IntegratedResult> integrated = new AtomicReference<>();
  private final AtomicBoolean claimed = new AtomicBoolean();
  private volatile PipelineState state = PipelineState.QUEUED;

  protected Payload(String id, long createdAtMillis) {
    this.id = Objects.requireNonNull(id, "id");
    this.createdAtMillis = createdAtMillis;
  }

  public final String id() {
    return id;
  }

  public final long createdAtMillis() {
    return createdAtMillis;
  }

  public final StageSlots<PerspectiveResult> branchA() {
    return branchA;
  }

  public final StageSlots<TemporalScopeResult> branchB() {
    return branchB;
  }

  public final PipelineState state() {
    return state;
  }

  public final void transitionTo(PipelineState next) {
    this.state = Objects.requireNonNull(next, "next");
  }

  public final Optional<IntegratedResult> integrated() {
    return Optional.ofNullable(integrated.get());
  }

  /**
   * Sets the integrated result.
   *
   * @param result folded output
   * @throws IllegalStateException if a result was already set
   */
  public final void integrate(IntegratedResult result) {
    Objects.requireNonNull(result, "result");
    if (!integrated.compareAndSet(null, result)) {
      throw new IllegalStateException("payload " + id + " already integrated");
    }
  }

  /**
   * Marks the payload as owned by a submitted envelope. Slots and the integrated result are
   * write-once, so a payload can be claimed only while it is unclaimed and carries no output.
   *
   * @return {@code true} when the claim succeeded
   */
  public final boolean claim() {
    if (state != PipelineState.QUEUED || integrated.get() != null || !branchA.isEmpty() || !branchB.isEmpty()) {
      return false;
    }
    return claimed.compareAndSet(false, true);
  }

  /**
   * Drops a claim taken for a submission that was then rejected.
   */
  public final void releaseClaim() {
    claimed.set(false);
  }

  /**
   * Returns the single-item envelope kind for this payload.
   *
   * @return {@link PayloadKind#TOKEN} or {@link PayloadKind#GRAPH}
   */
  public abstract PayloadKind kind();

  /**
   * Returns a short text identifying the payload in integration prompts.
   *
   * @return one-line summary
   */
  public abstract String summary();
}
