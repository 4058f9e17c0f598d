package ca.gc.cra.prism.domain.payload;

/**
 * Processing state of a single payload.
 * <p>The {@code *_FAILED} states mean at least one slot of that stage failed; integration still runs.</p>
 */
public enum PipelineState {
  QUEUED,
  STAGE_DETERMINED,
  BRANCH_A_RUNNING,
  BRANCH_A_DONE,
  BRANCH_A_FAILED,
  BRANCH_B_RUNNING,
  BRANCH_B_DONE,
  BRANCH_B_FAILED,
  INTEGRATING,
  COMPLETED,
  FAILED;

  /**
   * Returns whether no further transition is expected.
   *
   * @return {@code true} for {@link #COMPLETED} and {@link #FAILED}
   */
  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
