package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.application.port.CancellationToken;
import ca.gc.cra.prism.application.port.GenerateOptions;
import ca.gc.cra.prism.application.port.ReasonerException;
import ca.gc.cra.prism.application.port.ReasonerPort;
import ca.gc.cra.prism.domain.payload.BranchResult;
import ca.gc.cra.prism.domain.payload.Payload;
import ca.gc.cra.prism.domain.payload.StageSlots;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one Reasoner task per descriptor in parallel and joins them all.
 * <p><strong>Why:</strong> Both branch stages share the same fan-out shape and differ only in their
 * descriptor table, prompts and result type.</p>
 * <p><strong>Role:</strong> Base of {@link BranchAStage} and {@link BranchBStage}.</p>
 * <p><strong>Thread-safety:</strong> Tasks write only their own slot; the caller blocks on a latch until
 * every task finished. Stop does not interrupt the join.</p>
 *
 * @param <D> descriptor type
 * @param <R> result type
 * @since 0.1.0
 */
abstract class FanOutStage<D, R extends BranchResult> {
  private static final Logger log = LoggerFactory.getLogger(FanOutStage.class);

  private final Branch branch;
  private final List<D> descriptors;
  private final ReasonerPort reasoner;
  private final Executor executor;
  private final PipelineMetrics metrics;

  FanOutStage(
      Branch branch,
      List<D> descriptors,
      ReasonerPort reasoner,
      Executor executor,
      PipelineMetrics metrics) {
    this.branch = Objects.requireNonNull(branch, "branch");
    this.descriptors = List.copyOf(descriptors);
    if (this.descriptors.size() != branch.width()) {
      throw new IllegalArgumentException(branch.routeName() + " expects " + branch.width() + " descriptors");
    }
    this.reasoner = Objects.requireNonNull(reasoner, "reasoner");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Fans {@code payload} out to every descriptor and waits for all tasks.
   *
   * @param payload payload whose slots receive the results
   * @param cancellation stop signal forwarded to the Reasoner
   * @throws InterruptedException if the calling thread is interrupted while joining
   */
  final void run(Payload payload, CancellationToken cancellation) throws InterruptedException {
    StageSlots<R> slots = slots(payload);
    CountDownLatch done = new CountDownLatch(descriptors.size());
    Map<String, String> mdc = MDC.getCopyOfContextMap();
    for (int i = 0; i < descriptors.size(); i++) {
      int index = i;
      D descriptor = descriptors.get(i);
      Runnable task = () -> {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (mdc != null) {
          MDC.setContextMap(mdc);
        }
        try {
          record(slots, index, descriptor, payload, cancellation);
        } finally {
          restoreMdc(previous);
          done.countDown();
        }
      };
      try {
        executor.execute(task);
      } catch (RejectedExecutionException ex) {
        log.warn("{}[{}] rejected for {}: branch pool unavailable", branch.routeName(), index, payload.id());
        slots.fail(index, name(descriptor), ex);
        done.countDown();
      }
    }
    done.await();
    metrics.recordStage(branch, slots);
  }

  private void record(
      StageSlots<R> slots, int index, D descriptor, Payload payload, CancellationToken cancellation) {
    R result = null;
    Exception failure = null;
    try {
      String text = reasoner.generate(cancellation, prompt(payload), options(descriptor, payload));
      result = toResult(index, descriptor, text);
    } catch (ReasonerException | RuntimeException ex) {
      log.debug("{}[{}] {} failed for {}: {}",
          branch.routeName(), index, name(descriptor), payload.id(), ex.getMessage());
      failure = ex;
    }
    try {
      if (result != null) {
        slots.complete(index, result);
      } else {
        slots.fail(index, name(descriptor), failure);
      }
    } catch (RuntimeException ex) {
      // Only reachable when the slot was written outside this stage.
      log.warn("{}[{}] outcome for {} not recorded: {}", branch.routeName(), index, payload.id(), ex.getMessage());
    }
  }

  private static void restoreMdc(Map<String, String> previous) {
    if (previous == null) {
      MDC.clear();
    } else {
      MDC.setContextMap(previous);
    }
  }

  Branch branch() {
    return branch;
  }

  private GenerateOptions options(D descriptor, Payload payload) {
    return new GenerateOptions(
        systemPrompt(descriptor, payload),
        PromptTemplates.branchMaxTokens(payload),
        GenerateOptions.DEFAULT_TEMPERATURE);
  }

  String prompt(Payload payload) {
    return PromptTemplates.branchPrompt(payload);
  }

  abstract StageSlots<R> slots(Payload payload);

  abstract String name(D descriptor);

  abstract String systemPrompt(D descriptor, Payload payload);

  abstract R toResult(int index, D descriptor, String text);
}
