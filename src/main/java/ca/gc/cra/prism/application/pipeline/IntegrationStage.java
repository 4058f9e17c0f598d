package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.application.port.CancellationToken;
import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.GenerateOptions;
import ca.gc.cra.prism.application.port.ReasonerException;
import ca.gc.cra.prism.application.port.ReasonerPort;
import ca.gc.cra.prism.domain.clock.ClockState;
import ca.gc.cra.prism.domain.payload.Envelope;
import ca.gc.cra.prism.domain.payload.ErrorKind;
import ca.gc.cra.prism.domain.payload.IntegratedResult;
import ca.gc.cra.prism.domain.payload.IntegrationFocus;
import ca.gc.cra.prism.domain.payload.Payload;
import ca.gc.cra.prism.domain.payload.PayloadError;
import ca.gc.cra.prism.domain.payload.PerspectiveResult;
import ca.gc.cra.prism.domain.payload.PipelineState;
import ca.gc.cra.prism.domain.payload.StageSlots;
import ca.gc.cra.prism.domain.payload.TemporalScopeResult;
import ca.gc.cra.prism.logging.Logs;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Folds both branch outputs of a payload into one {@link IntegratedResult}.
 * <p><strong>Why:</strong> The weighting depends on the gating flags captured at entry: {@code holdA}
 * restricts the fold to Branch-B, otherwise {@code holdB} restricts it to Branch-A, otherwise both
 * count equally.</p>
 * <p><strong>Role:</strong> Last step per payload, after both branch stages joined.</p>
 * <p>The stages the focus weighs must contribute at least one result. When they do not, the payload
 * fails with a {@link ErrorKind#BRANCH} error naming the lowest-index slot failure and the Reasoner
 * is not called.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from collaborators; runs on the envelope thread.</p>
 *
 * @since 0.1.0
 */
final class IntegrationStage {
  private static final Logger log = LoggerFactory.getLogger(IntegrationStage.class);
  static final String COMPONENT = "integration";
  private static final int LOG_PREVIEW_BYTES = 120;

  private final ReasonerPort reasoner;
  private final ClockPort clock;
  private final PipelineMetrics metrics;

  IntegrationStage(ReasonerPort reasoner, ClockPort clock, PipelineMetrics metrics) {
    this.reasoner = Objects.requireNonNull(reasoner, "reasoner");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Integrates {@code payload} under the gating snapshot recorded on {@code envelope}.
   *
   * @param envelope envelope receiving route entries and errors
   * @param payload payload whose slots are folded
   * @param cancellation stop signal forwarded to the Reasoner
   * @return {@code true} when an integrated result was set
   */
  boolean run(Envelope envelope, Payload payload, CancellationToken cancellation) {
    payload.transitionTo(PipelineState.INTEGRATING);
    ClockState entry = envelope.entryState()
        .orElseThrow(() -> new IllegalStateException("envelope " + envelope.id() + " has no entry snapshot"));
    IntegrationFocus focus = IntegrationFocus.forGating(entry.gating());
    List<PerspectiveResult> perspectives = payload.branchA().results();
    List<TemporalScopeResult> temporalScopes = payload.branchB().results();

    boolean usable = (focus.weighsBranchA() && !perspectives.isEmpty())
        || (focus.weighsBranchB() && !temporalScopes.isEmpty());
    if (!usable) {
      String message = "no " + focus + " branch outputs available"
          + firstFailure(payload, focus).map(f -> "; first failure " + f).orElse("");
      fail(envelope, payload, ErrorKind.BRANCH, message);
      return false;
    }

    GenerateOptions options = new GenerateOptions(
        PromptTemplates.integrationSystem(entry, focus),
        PromptTemplates.INTEGRATION_MAX_TOKENS,
        GenerateOptions.DEFAULT_TEMPERATURE);
    String prompt = PromptTemplates.integrationPrompt(
        payload, PromptTemplates.summarize(perspectives), PromptTemplates.summarize(temporalScopes));
    String text;
    try {
      text = reasoner.generate(cancellation, prompt, options);
      if (text == null) {
        throw new ReasonerException("no text returned");
      }
      payload.integrate(new IntegratedResult(
          entry.step(), entry.gating(), focus, perspectives.size(), temporalScopes.size(), text));
    } catch (ReasonerException | RuntimeException ex) {
      metrics.recordIntegrationFailure();
      fail(envelope, payload, ErrorKind.INTEGRATION, "reasoner failed: " + ex.getMessage());
      return false;
    }

    payload.transitionTo(PipelineState.COMPLETED);
    envelope.appendRoute("integration:complete");
    log.debug("Integrated {} with focus {} ({} + {} outputs): {}",
        payload.id(), focus, perspectives.size(), temporalScopes.size(), Logs.preview(text, LOG_PREVIEW_BYTES));
    return true;
  }

  private void fail(Envelope envelope, Payload payload, ErrorKind kind, String message) {
    payload.transitionTo(PipelineState.FAILED);
    envelope.recordError(new PayloadError(clock.nowMillis(), COMPONENT, kind, envelope.entryStep(), message));
    log.debug("Integration of {} failed: {}", payload.id(), message);
  }

  private static Optional<String> firstFailure(Payload payload, IntegrationFocus focus) {
    if (focus.weighsBranchA()) {
      Optional<String> a = describeFirst(payload.branchA());
      if (a.isPresent()) {
        return a;
      }
    }
    return focus.weighsBranchB() ? describeFirst(payload.branchB()) : Optional.empty();
  }

  private static Optional<String> describeFirst(StageSlots<?> slots) {
    return slots.failures().stream()
        .findFirst()
        .map(f -> slots.stage() + "[" + f.index() + "] " + f.descriptorName() + ": " + f.message());
  }
}
