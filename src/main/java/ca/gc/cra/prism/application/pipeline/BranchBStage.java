package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.application.port.ReasonerPort;
import ca.gc.cra.prism.domain.payload.Payload;
import ca.gc.cra.prism.domain.payload.StageSlots;
import ca.gc.cra.prism.domain.payload.TemporalScopeResult;
import ca.gc.cra.prism.domain.stage.TemporalScope;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Branch-B: one task per cell of the 3x3 {@link TemporalScope} grid.
 */
final class BranchBStage extends FanOutStage<TemporalScope, TemporalScopeResult> {

  BranchBStage(ReasonerPort reasoner, Executor executor, PipelineMetrics metrics) {
    super(Branch.B, List.of(TemporalScope.values()), reasoner, executor, metrics);
  }

  @Override
  StageSlots<TemporalScopeResult> slots(Payload payload) {
    return payload.branchB();
  }

  @Override
  String name(TemporalScope descriptor) {
    return descriptor.displayName();
  }

  @Override
  String systemPrompt(TemporalScope descriptor, Payload payload) {
    return PromptTemplates.temporalScopeSystem(descriptor, payload);
  }

  @Override
  TemporalScopeResult toResult(int index, TemporalScope descriptor, String text) {
    return new TemporalScopeResult(
        index,
        descriptor.displayName(),
        descriptor.temporal(),
        descriptor.scope(),
        descriptor.row(),
        descriptor.column(),
        text,
        TemporalScopeResult.DEFAULT_WEIGHT);
  }
}
