package ca.gc.cra.prism.domain.payload;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.domain.clock.GatingState;
import org.junit.jupiter.api.Test;

class IntegrationFocusTest {

  @Test
  void holdATakesPrecedence() {
    assertEquals(IntegrationFocus.BRANCH_B_ONLY, IntegrationFocus.forGating(new GatingState(true, true)));
    assertEquals(IntegrationFocus.BRANCH_B_ONLY, IntegrationFocus.forGating(new GatingState(true, false)));
  }

  @Test
  void holdBAloneSelectsBranchA() {
    assertEquals(IntegrationFocus.BRANCH_A_ONLY, IntegrationFocus.forGating(new GatingState(false, true)));
  }

  @Test
  void noHoldWeighsBoth() {
    IntegrationFocus focus = IntegrationFocus.forGating(GatingState.NONE);
    assertEquals(IntegrationFocus.EQUAL, focus);
    assertTrue(focus.weighsBranchA());
    assertTrue(focus.weighsBranchB());
    assertFalse(IntegrationFocus.BRANCH_B_ONLY.weighsBranchA());
    assertFalse(IntegrationFocus.BRANCH_A_ONLY.weighsBranchB());
  }
}
