package ca.gc.cra.prism.domain.payload;

import ca.gc.cra.prism.domain.clock.GatingState;
import java.util.Objects;

/**
 * <strong>What:</strong> Which branch outputs the integration step weighs.
 * <p><strong>Role:</strong> Derived from the entry gating snapshot by {@link #forGating(GatingState)}.</p>
 *
 * @since 0.1.0
 */
public enum IntegrationFocus {
  /** Only Branch-B outputs are weighed. */
  BRANCH_B_ONLY,
  /** Only Branch-A outputs are weighed. */
  BRANCH_A_ONLY,
  /** Both branches are weighed equally. */
  EQUAL;

  /**
   * Resolves the focus for a gating snapshot. {@code holdA} takes precedence over {@code holdB}.
   *
   * @param gating entry gating snapshot
   * @return integration focus
   */
  public static IntegrationFocus forGating(GatingState gating) {
    Objects.requireNonNull(gating, "gating");
    if (gating.holdA()) {
      return BRANCH_B_ONLY;
    }
    if (gating.holdB()) {
      return BRANCH_A_ONLY;
    }
    return EQUAL;
  }

  public boolean weighsBranchA() {
    return this != BRANCH_B_ONLY;
  }

  public boolean weighsBranchB() {
    return this != BRANCH_A_ONLY;
  }
}
