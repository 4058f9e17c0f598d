package ca.gc.cra.prism.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.port.CancellationToken;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.domain.payload.PerspectiveResult;
import ca.gc.cra.prism.domain.payload.Token;
import ca.gc.cra.prism.domain.payload.TokenKind;
import ca.gc.cra.prism.domain.stage.Perspective;
import ca.gc.cra.prism.infrastructure.exec.ExecutorFactories;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class FanOutStageTest {
  private final AtomicInteger uncaught = new AtomicInteger();
  private final ExecutorService executor =
      ExecutorFactories.newFixedPool(Perspective.WIDTH, "fan-out-test", (thread, ex) -> uncaught.incrementAndGet());

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void fillsEverySlotWithItsDescriptor() throws Exception {
    BranchAStage stage = new BranchAStage(new ScriptedReasoner().echoDescriptor(), executor,
        new PipelineMetrics(MetricsPort.NO_OP));
    Token token = new Token("tok-fan-1", 0L, "hi", TokenKind.PERCEPT, "test");

    stage.run(token, CancellationToken.NONE);

    assertEquals(Perspective.WIDTH, token.branchA().resultCount());
    for (Perspective perspective : Perspective.values()) {
      PerspectiveResult result = token.branchA().result(perspective.ordinal()).orElseThrow();
      assertEquals(perspective.displayName(), result.descriptorName());
      assertEquals(perspective.displayName() + ":hi", result.text());
    }
  }

  @Test
  void alreadyWrittenSlotDoesNotKillBranchWorkers() throws Exception {
    BranchAStage stage = new BranchAStage(new ScriptedReasoner(), executor, new PipelineMetrics(MetricsPort.NO_OP));
    Token token = new Token("tok-fan-2", 0L, "again", TokenKind.PERCEPT, "test");
    PerspectiveResult earlier = new PerspectiveResult(
        0, Perspective.PERCEPTION_ACTION_LEARNING.displayName(), "000", "earlier", PerspectiveResult.DEFAULT_CONFIDENCE);
    token.branchA().complete(0, earlier);

    stage.run(token, CancellationToken.NONE);
    executor.shutdown();
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

    assertEquals(0, uncaught.get());
    assertEquals(earlier, token.branchA().result(0).orElseThrow());
    assertEquals(Perspective.WIDTH, token.branchA().resultCount());
  }
}
