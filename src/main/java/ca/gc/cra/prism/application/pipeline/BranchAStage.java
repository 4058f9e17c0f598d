package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.application.port.ReasonerPort;
import ca.gc.cra.prism.domain.payload.Payload;
import ca.gc.cra.prism.domain.payload.PerspectiveResult;
import ca.gc.cra.prism.domain.payload.StageSlots;
import ca.gc.cra.prism.domain.stage.Perspective;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Branch-A: one task per {@link Perspective}, eight in total.
 */
final class BranchAStage extends FanOutStage<Perspective, PerspectiveResult> {

  BranchAStage(ReasonerPort reasoner, Executor executor, PipelineMetrics metrics) {
    super(Branch.A, List.of(Perspective.values()), reasoner, executor, metrics);
  }

  @Override
  StageSlots<PerspectiveResult> slots(Payload payload) {
    return payload.branchA();
  }

  @Override
  String name(Perspective descriptor) {
    return descriptor.displayName();
  }

  @Override
  String systemPrompt(Perspective descriptor, Payload payload) {
    return PromptTemplates.perspectiveSystem(descriptor, payload);
  }

  @Override
  PerspectiveResult toResult(int index, Perspective descriptor, String text) {
    return new PerspectiveResult(
        index, descriptor.displayName(), descriptor.binaryCode(), text, PerspectiveResult.DEFAULT_CONFIDENCE);
  }
}
