package ca.gc.cra.prism.application.pipeline;

/**
 * How a batch envelope reacts to a failed item.
 */
public enum BatchPolicy {
  /** Stop at the first failed item; later items are never attempted. */
  FAIL_FAST,
  /** Attempt every item and collect all failures. */
  CONTINUE_ON_ERROR
}
