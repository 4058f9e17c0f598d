package ca.gc.cra.prism.domain.payload;

import ca.gc.cra.prism.domain.clock.GatingState;
import java.util.Objects;

/**
 * Final folded output of a payload.
 *
 * @param step clock step captured at entry
 * @param gating gating snapshot the focus was derived from
 * @param focus branch weighting applied
 * @param branchAUsed number of Branch-A outputs available to the fold
 * @param branchBUsed number of Branch-B outputs available to the fold
 * @param text Reasoner output
 */
public record IntegratedResult(
    int step, GatingState gating, IntegrationFocus focus, int branchAUsed, int branchBUsed, String text) {
  public IntegratedResult {
    Objects.requireNonNull(gating, "gating");
    Objects.requireNonNull(focus, "focus");
    Objects.requireNonNull(text, "text");
  }
}
