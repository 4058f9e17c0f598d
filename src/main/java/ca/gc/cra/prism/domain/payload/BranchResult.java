package ca.gc.cra.prism.domain.payload;

/**
 * <strong>What:</strong> Output of one branch task.
 * <p><strong>Role:</strong> Closed sum over the two branch stages; each stage has its own record.</p>
 *
 * @since 0.1.0
 */
public sealed interface BranchResult permits PerspectiveResult, TemporalScopeResult {
  /**
   * Returns the slot index the result occupies.
   *
   * @return slot index within its stage
   */
  int index();

  /**
   * Returns the descriptor name, used as the label in integration summaries.
   *
   * @return descriptor name
   */
  String descriptorName();

  /**
   * Returns the Reasoner output text.
   *
   * @return generated text
   */
  String text();
}
