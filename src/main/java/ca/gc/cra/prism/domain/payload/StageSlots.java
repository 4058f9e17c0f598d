package ca.gc.cra.prism.domain.payload;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * <strong>What:</strong> Fixed-width array of write-once result cells for one branch stage.
 * <p><strong>Why:</strong> Each branch task owns exactly one cell and records either its result or its
 * failure there, so concurrent tasks never coordinate on a shared error flag.</p>
 * <p><strong>Role:</strong> Held by every {@link Payload}; filled by the fan-out stage and read by
 * integration.</p>
 * <p><strong>Thread-safety:</strong> Cells are published through {@link AtomicReferenceArray}; a second
 * write to the same cell throws {@link IllegalStateException}.</p>
 *
 * @param <R> result type stored by the stage
 * @since 0.1.0
 */
public final class StageSlots<R extends BranchResult> {
  private final String stage;
  private final AtomicReferenceArray<Cell<R>> cells;

  /**
   * Creates empty slots.
   *
   * @param stage stage name used in failure messages
   * @param width number of cells
   */
  public StageSlots(String stage, int width) {
    this.stage = Objects.requireNonNull(stage, "stage");
    if (width <= 0) {
      throw new IllegalArgumentException("width must be positive");
    }
    this.cells = new AtomicReferenceArray<>(width);
  }

  public String stage() {
    return stage;
  }

  public int width() {
    return cells.length();
  }

  /**
   * Stores the result for {@code index}.
   *
   * @param index cell index
   * @param result branch result; its {@link BranchResult#index()} must equal {@code index}
   * @throws IllegalStateException if the cell already holds a result or a failure
   */
  public void complete(int index, R result) {
    Objects.requireNonNull(result, "result");
    if (result.index() != index) {
      throw new IllegalArgumentException(
          "result index " + result.index() + " does not match slot " + index);
    }
    write(index, new Filled<>(result));
  }

  /**
   * Stores a failure for {@code index}.
   *
   * @param index cell index
   * @param descriptorName descriptor the failed task was bound to
   * @param cause failure raised by the task
   * @throws IllegalStateException if the cell already holds a result or a failure
   */
  public void fail(int index, String descriptorName, Throwable cause) {
    Objects.requireNonNull(cause, "cause");
    write(index, new Failed<>(new SlotFailure(index, descriptorName, describe(cause), cause)));
  }

  /**
   * Stores a failure known only by its message, as read back from a serialized envelope.
   *
   * @param index cell index
   * @param descriptorName descriptor the failed task was bound to
   * @param message failure message
   * @throws IllegalStateException if the cell already holds a result or a failure
   */
  public void fail(int index, String descriptorName, String message) {
    write(index, new Failed<>(new SlotFailure(index, descriptorName, message, null)));
  }

  private void write(int index, Cell<R> cell) {
    if (!cells.compareAndSet(index, null, cell)) {
      throw new IllegalStateException(stage + " slot " + index + " already written");
    }
  }

  /**
   * Returns the result held in {@code index}, if any.
   *
   * @param index cell index
   * @return result, or empty when the cell is unset or failed
   */
  public Optional<R> result(int index) {
    return cells.get(index) instanceof Filled<R> filled ? Optional.of(filled.result()) : Optional.empty();
  }

  public Optional<SlotFailure> failure(int index) {
    return cells.get(index) instanceof Failed<R> failed ? Optional.of(failed.failure()) : Optional.empty();
  }

  /**
   * Returns present results in index order.
   *
   * @return immutable list of results
   */
  public List<R> results() {
    List<R> out = new ArrayList<>(cells.length());
    for (int i = 0; i < cells.length(); i++) {
      result(i).ifPresent(out::add);
    }
    return Collections.unmodifiableList(out);
  }

  /**
   * Returns recorded failures in index order.
   *
   * @return immutable list of failures
   */
  public List<SlotFailure> failures() {
    List<SlotFailure> out = new ArrayList<>();
    for (int i = 0; i < cells.length(); i++) {
      failure(i).ifPresent(out::add);
    }
    return Collections.unmodifiableList(out);
  }

  public int resultCount() {
    return results().size();
  }

  /**
   * Returns whether every cell holds a result.
   *
   * @return {@code true} when all cells completed successfully
   */
  public boolean isComplete() {
    return resultCount() == cells.length();
  }

  /**
   * Returns whether no cell has been written yet.
   *
   * @return {@code true} for fresh slots
   */
  public boolean isEmpty() {
    for (int i = 0; i < cells.length(); i++) {
      if (cells.get(i) != null) {
        return false;
      }
    }
    return true;
  }

  private static String describe(Throwable cause) {
    String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
  }

  /**
   * Failure recorded in a cell.
   *
   * @param index cell index
   * @param descriptorName descriptor bound to the failed task
   * @param message failure message
   * @param cause original throwable, {@code null} when read back from a serialized envelope
   */
  public record SlotFailure(int index, String descriptorName, String message, Throwable cause) {
    public SlotFailure {
      message = message == null ? "" : message;
    }
  }

  /** Content of a written cell. */
  private sealed interface Cell<R extends BranchResult> permits Filled, Failed {}

  private record Filled<R extends BranchResult>(R result) implements Cell<R> {}

  private record Failed<R extends BranchResult>(SlotFailure failure) implements Cell<R> {}
}
