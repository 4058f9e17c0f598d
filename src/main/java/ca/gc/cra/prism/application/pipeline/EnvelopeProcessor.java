package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.application.port.CancellationToken;
import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.StepClockPort;
import ca.gc.cra.prism.domain.clock.ClockState;
import ca.gc.cra.prism.domain.payload.Envelope;
import ca.gc.cra.prism.domain.payload.ErrorKind;
import ca.gc.cra.prism.domain.payload.Payload;
import ca.gc.cra.prism.domain.payload.PayloadError;
import ca.gc.cra.prism.domain.payload.PipelineState;
import ca.gc.cra.prism.domain.stage.StageRouter;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Drives one envelope through routing, both branch stages and integration.
 * <p><strong>Role:</strong> Body of the per-envelope task scheduled by {@link PipelineController}.</p>
 * <p>The step clock is sampled exactly once, on entry; batch items reuse that snapshot.</p>
 * <p><strong>Thread-safety:</strong> One instance serves all envelope threads; per-envelope state lives
 * on the envelope.</p>
 *
 * @since 0.1.0
 */
final class EnvelopeProcessor {
  private static final Logger log = LoggerFactory.getLogger(EnvelopeProcessor.class);

  private final StepClockPort stepClock;
  private final ClockPort clock;
  private final EnvelopeFactory factory;
  private final BranchAStage branchA;
  private final BranchBStage branchB;
  private final IntegrationStage integration;
  private final BatchPolicy batchPolicy;

  EnvelopeProcessor(
      StepClockPort stepClock,
      ClockPort clock,
      EnvelopeFactory factory,
      BranchAStage branchA,
      BranchBStage branchB,
      IntegrationStage integration,
      BatchPolicy batchPolicy) {
    this.stepClock = Objects.requireNonNull(stepClock, "stepClock");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.factory = Objects.requireNonNull(factory, "factory");
    this.branchA = Objects.requireNonNull(branchA, "branchA");
    this.branchB = Objects.requireNonNull(branchB, "branchB");
    this.integration = Objects.requireNonNull(integration, "integration");
    this.batchPolicy = Objects.requireNonNull(batchPolicy, "batchPolicy");
  }

  /**
   * Processes {@code envelope} to completion. Per-item failures are recorded on the envelope.
   *
   * @param envelope envelope to process
   * @param cancellation stop signal forwarded to Reasoner calls
   * @throws InterruptedException if the thread is interrupted while joining a branch stage
   */
  void process(Envelope envelope, CancellationToken cancellation) throws InterruptedException {
    ClockState state = stepClock.currentState();
    String stage = StageRouter.determineStage(state.step());
    envelope.enter(state, stage);
    envelope.appendRoute("stage:" + stage);
    log.debug("Envelope {} entered at step {} ({}), holdA={}, holdB={}",
        envelope.id(), state.step(), stage, state.holdA(), state.holdB());

    if (envelope.content().isBatch()) {
      processBatch(envelope, cancellation);
    } else {
      processPayload(envelope, envelope.payloads().get(0), cancellation);
    }
  }

  private boolean processPayload(Envelope envelope, Payload payload, CancellationToken cancellation)
      throws InterruptedException {
    payload.transitionTo(PipelineState.STAGE_DETERMINED);
    runBranch(envelope, payload, branchA, cancellation,
        PipelineState.BRANCH_A_RUNNING, PipelineState.BRANCH_A_DONE, PipelineState.BRANCH_A_FAILED);
    runBranch(envelope, payload, branchB, cancellation,
        PipelineState.BRANCH_B_RUNNING, PipelineState.BRANCH_B_DONE, PipelineState.BRANCH_B_FAILED);
    return integration.run(envelope, payload, cancellation);
  }

  private static void runBranch(
      Envelope envelope,
      Payload payload,
      FanOutStage<?, ?> stage,
      CancellationToken cancellation,
      PipelineState running,
      PipelineState done,
      PipelineState failed) throws InterruptedException {
    payload.transitionTo(running);
    stage.run(payload, cancellation);
    boolean complete = stage.slots(payload).isComplete();
    payload.transitionTo(complete ? done : failed);
    envelope.appendRoute(stage.branch().routeName() + (complete ? ":complete" : ":partial"));
  }

  /**
   * Processes one batch item, converting an unexpected runtime failure into a {@code processor} error on
   * the item so the batch policy decides whether the batch continues.
   */
  private boolean processItem(Envelope item, Payload payload, CancellationToken cancellation)
      throws InterruptedException {
    try {
      return processPayload(item, payload, cancellation);
    } catch (RuntimeException ex) {
      log.warn("Batch item {} of {} failed", payload.id(), item.id(), ex);
      item.recordError(new PayloadError(clock.nowMillis(), "processor", ErrorKind.PROCESSOR, item.entryStep(),
          ex.toString()));
      if (!payload.state().isTerminal()) {
        payload.transitionTo(PipelineState.FAILED);
      }
      return false;
    }
  }

  private void processBatch(Envelope batch, CancellationToken cancellation) throws InterruptedException {
    List<? extends Payload> items = batch.payloads();
    for (int i = 0; i < items.size(); i++) {
      Payload payload = items.get(i);
      Envelope item = factory.childOf(batch, i, payload);
      boolean ok = processItem(item, payload, cancellation);
      String prefix = "batch[" + i + "]";
      for (PayloadError error : item.errors()) {
        batch.recordError(error.withComponentPrefix(prefix));
      }
      batch.appendRoute("item[" + i + "]:" + (ok ? "complete" : "failed"));
      if (!ok && batchPolicy == BatchPolicy.FAIL_FAST) {
        int skipped = items.size() - i - 1;
        batch.appendRoute("batch:aborted");
        batch.recordError(new PayloadError(clock.nowMillis(), "batch", ErrorKind.BATCH, batch.entryStep(),
            "aborted after item " + i + "; " + skipped + " item(s) not attempted"));
        log.debug("Batch {} aborted at item {} with {} remaining", batch.id(), i, skipped);
        return;
      }
    }
  }
}
