package ca.gc.cra.prism.application.pipeline;

import java.util.Objects;

/**
 * Thrown when a lifecycle call does not fit the controller's current state.
 */
public final class PipelineStateException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  /** Lifecycle violation. */
  public enum Kind {
    /** {@code start()} on a running controller. */
    ALREADY_RUNNING,
    /** {@code stop()} on a controller that is not running. */
    NOT_RUNNING,
    /** {@code start()} on a stopped controller; controllers are single-use. */
    TERMINATED
  }

  private final Kind kind;

  public PipelineStateException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public Kind kind() {
    return kind;
  }
}
