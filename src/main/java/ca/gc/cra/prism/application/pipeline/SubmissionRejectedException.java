package ca.gc.cra.prism.application.pipeline;

import java.util.Objects;

/**
 * Thrown by {@link PipelineController#submit} when an envelope cannot be accepted.
 * <p>Submission never blocks; callers decide whether to retry, shed or surface the rejection.</p>
 */
public final class SubmissionRejectedException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Why the envelope was rejected. */
  public enum Reason {
    /** The input queue is at capacity. */
    QUEUE_FULL,
    /** The controller was stopped. */
    STOPPED,
    /** An envelope with the same id is already in flight. */
    DUPLICATE_ID,
    /** A payload of the envelope was already submitted in another envelope. */
    PAYLOAD_REUSED
  }

  private final Reason reason;
  private final String envelopeId;

  public SubmissionRejectedException(Reason reason, String envelopeId, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
    this.envelopeId = envelopeId;
  }

  public Reason reason() {
    return reason;
  }

  public String envelopeId() {
    return envelopeId;
  }
}
