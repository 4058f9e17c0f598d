package ca.gc.cra.prism.domain.payload;

/**
 * Classifies a {@link PayloadError} by the part of processing that produced it.
 */
public enum ErrorKind {
  /** Branch outputs required by integration were unavailable. */
  BRANCH,
  /** The integration Reasoner call failed. */
  INTEGRATION,
  /** An unexpected failure escaped the per-envelope task. */
  PROCESSOR,
  /** A batch stopped early. */
  BATCH
}
