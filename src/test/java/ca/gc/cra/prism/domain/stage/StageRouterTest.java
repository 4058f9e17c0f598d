package ca.gc.cra.prism.domain.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class StageRouterTest {

  @ParameterizedTest
  @CsvSource({
      "1, Perception", "6, Perception",
      "7, Analysis", "12, Analysis",
      "13, Planning", "18, Planning",
      "19, Execution", "24, Execution",
      "25, Integration", "30, Integration"
  })
  void stepsMapToTheirPhase(int step, String expected) {
    assertEquals(expected, StageRouter.determineStage(step));
  }

  @ParameterizedTest
  @ValueSource(ints = {0, -1, 31, 1000})
  void stepsOutsideTheCycleAreUnknown(int step) {
    assertEquals(StageRouter.UNKNOWN, StageRouter.determineStage(step));
  }

  @Test
  void tableCoversEveryStepExactlyOnce() {
    int covered = 0;
    for (StageRouter.StageDefinition stage : StageRouter.table()) {
      assertEquals(6, stage.steps().size(), stage.name());
      covered += stage.steps().size();
    }
    assertEquals(30, covered);
  }
}
