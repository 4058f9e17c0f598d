package ca.gc.cra.prism.domain.payload;

import ca.gc.cra.prism.domain.clock.ClockState;
import ca.gc.cra.prism.domain.clock.GatingState;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * <strong>What:</strong> The unit moving through the pipeline: content plus routing and error metadata.
 * <p><strong>Why:</strong> Consumers of the output queue need the route taken, the clock snapshot the
 * envelope was processed under, and any failures, next to the enriched payloads.</p>
 * <p><strong>Role:</strong> Domain entity created by the envelope factory, mutated only by the one task
 * processing it, then published on the output queue.</p>
 * <p><strong>Thread-safety:</strong> Route and error lists are copy-on-write; scalar fields are volatile
 * and written by the processing task before the envelope is published.</p>
 *
 * @since 0.1.0
 */
public final class Envelope {
  /** Stage name before routing. */
  public static final String UNASSIGNED_STAGE = "unassigned";

  private final String id;
  private final EnvelopeContent content;
  private final int priority;
  private final long createdAtMillis;
  private final List<String> route = new CopyOnWriteArrayList<>();
  private final List<PayloadError> errors = new CopyOnWriteArrayList<>();
  private volatile ClockState entryState;
  private volatile String stage = UNASSIGNED_STAGE;
  private volatile int exitStep;
  private volatile long exitAtMillis;

  public Envelope(String id, EnvelopeContent content, int priority, long createdAtMillis) {
    this.id = Objects.requireNonNull(id, "id");
    this.content = Objects.requireNonNull(content, "content");
    this.priority = priority;
    this.createdAtMillis = createdAtMillis;
  }

  public String id() {
    return id;
  }

  public EnvelopeContent content() {
    return content;
  }

  public PayloadKind kind() {
    return content.kind();
  }

  public List<? extends Payload> payloads() {
    return content.payloads();
  }

  /**
   * Returns the priority; higher values are more urgent.
   *
   * @return priority
   */
  public int priority() {
    return priority;
  }

  public long createdAtMillis() {
    return createdAtMillis;
  }

  /**
   * Records the clock snapshot and phase assigned at entry.
   *
   * @param state snapshot read once from the step clock
   * @param stageName phase name from the router
   * @throws IllegalStateException if an entry snapshot was already recorded
   */
  public void enter(ClockState state, String stageName) {
    Objects.requireNonNull(state, "state");
    if (entryState != null) {
      throw new IllegalStateException("envelope " + id + " already entered");
    }
    this.entryState = state;
    this.stage = Objects.requireNonNull(stageName, "stageName");
  }

  public Optional<ClockState> entryState() {
    return Optional.ofNullable(entryState);
  }

  /**
   * Returns the entry step, or 0 before entry.
   *
   * @return clock step captured at entry
   */
  public int entryStep() {
    ClockState state = entryState;
    return state == null ? 0 : state.step();
  }

  /**
   * Returns the gating snapshot captured at entry, or {@link GatingState#NONE} before entry.
   *
   * @return gating snapshot
   */
  public GatingState gating() {
    ClockState state = entryState;
    return state == null ? GatingState.NONE : state.gating();
  }

  public String stage() {
    return stage;
  }

  public void exit(int step, long atMillis) {
    this.exitStep = step;
    this.exitAtMillis = atMillis;
  }

  public int exitStep() {
    return exitStep;
  }

  /**
   * Returns the exit time, or 0 while still in flight.
   *
   * @return epoch millis the envelope finished processing
   */
  public long exitAtMillis() {
    return exitAtMillis;
  }

  public void appendRoute(String entry) {
    route.add(Objects.requireNonNull(entry, "entry"));
  }

  /**
   * Returns an immutable copy of the route log.
   *
   * @return route entries in append order
   */
  public List<String> route() {
    return List.copyOf(route);
  }

  public void recordError(PayloadError error) {
    errors.add(Objects.requireNonNull(error, "error"));
  }

  /**
   * Returns an immutable copy of the error list.
   *
   * @return errors in append order
   */
  public List<PayloadError> errors() {
    return List.copyOf(errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /**
   * Returns whether every payload carries an integrated result.
   *
   * @return {@code true} when processing produced a full result
   */
  public boolean isCompleted() {
    List<? extends Payload> items = content.payloads();
    if (items.isEmpty()) {
      return !hasErrors();
    }
    for (Payload payload : items) {
      if (payload.integrated().isEmpty()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return "Envelope{" + id + ", " + content.kind() + ", stage=" + stage + "}";
  }
}
