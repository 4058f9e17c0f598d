package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.application.port.CancellationToken;
import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.port.ReasonerPort;
import ca.gc.cra.prism.application.port.StepClockPort;
import ca.gc.cra.prism.domain.payload.Envelope;
import ca.gc.cra.prism.domain.payload.ErrorKind;
import ca.gc.cra.prism.domain.payload.Graph;
import ca.gc.cra.prism.domain.payload.Payload;
import ca.gc.cra.prism.domain.payload.PayloadError;
import ca.gc.cra.prism.domain.payload.PipelineState;
import ca.gc.cra.prism.domain.payload.Token;
import ca.gc.cra.prism.domain.payload.TokenKind;
import ca.gc.cra.prism.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.prism.logging.Logs;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Owns the bounded input and output queues, the dispatch loop, the worker pools
 * and the lifecycle of the pipeline.
 * <p><strong>Why:</strong> Callers submit envelopes without blocking while a single dispatcher feeds at
 * most {@code maxInFlight} concurrent envelope tasks.</p>
 * <p><strong>Role:</strong> Application entry point; each envelope task runs routing, Branch-A (8
 * parallel calls), Branch-B (9 parallel calls) and integration, then publishes to the output queue.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject submissions when stopped, full, carrying an id already in flight, or reusing a payload.</li>
 *   <li>Gate envelope tasks with a semaphore sized {@code maxInFlight}.</li>
 *   <li>Publish finished envelopes with a non-blocking offer, dropping and counting on overflow.</li>
 *   <li>Shut the pools down once stop fired and the last in-flight envelope finished.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All public methods are safe to call from any thread.</p>
 * <p><strong>Observability:</strong> Emits {@code pipeline.submit.*}, {@code pipeline.envelope.*},
 * {@code pipeline.inflight} and {@code pipeline.worker.uncaught}; MDC key {@code envelope} is set on
 * envelope and branch threads.</p>
 *
 * @since 0.1.0
 */
public final class PipelineController {
  private static final Logger log = LoggerFactory.getLogger(PipelineController.class);
  private static final long DISPATCH_IDLE_POLL_MILLIS = 25L;
  private static final int LOG_PREVIEW_CHARS = 64;
  static final String MDC_ENVELOPE = "envelope";

  private enum Lifecycle { NEW, RUNNING, STOPPED }

  private final PipelineSettings settings;
  private final StepClockPort stepClock;
  private final ClockPort clock;
  private final MetricsPort metricsPort;
  private final PipelineMetrics metrics;
  private final EnvelopeFactory factory;
  private final EnvelopeProcessor processor;
  private final BlockingQueue<Envelope> inputQueue;
  private final BlockingQueue<Envelope> outputQueue;
  private final EnvelopeOutput output;
  private final Map<String, Envelope> inFlight = new ConcurrentHashMap<>();
  private final Semaphore permits;
  private final AtomicReference<Lifecycle> lifecycle = new AtomicReference<>(Lifecycle.NEW);
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final CancellationToken cancellation = stopRequested::get;
  private final Object drainMonitor = new Object();
  private final ExecutorService dispatchExecutor;
  private final ExecutorService envelopeExecutor;
  private final ExecutorService branchExecutor;

  /**
   * Creates a controller. Worker threads are only started by {@link #start()}.
   *
   * @param settings queue capacities, concurrency limit and batch policy
   * @param reasoner text generator used by every stage
   * @param stepClock global step clock, sampled once per envelope
   * @param clock wall clock for timestamps
   * @param metricsPort metrics sink
   */
  public PipelineController(
      PipelineSettings settings,
      ReasonerPort reasoner,
      StepClockPort stepClock,
      ClockPort clock,
      MetricsPort metricsPort) {
    this.settings = Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(reasoner, "reasoner");
    this.stepClock = Objects.requireNonNull(stepClock, "stepClock");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metricsPort = Objects.requireNonNull(metricsPort, "metricsPort");
    this.metrics = new PipelineMetrics(metricsPort);
    this.factory = new EnvelopeFactory(clock);
    this.inputQueue = new ArrayBlockingQueue<>(settings.inputQueueCapacity());
    this.outputQueue = new ArrayBlockingQueue<>(settings.outputQueueCapacity());
    this.output = new EnvelopeOutput(outputQueue);
    this.permits = new Semaphore(settings.maxInFlight());
    this.dispatchExecutor = ExecutorFactories.newFixedPool(1, "prism-dispatch", this::handleWorkerCrash);
    this.envelopeExecutor =
        ExecutorFactories.newFixedPool(settings.maxInFlight(), "prism-envelope", this::handleWorkerCrash);
    this.branchExecutor = ExecutorFactories.newFixedPool(
        settings.maxInFlight() * Branch.B.width(), "prism-branch", this::handleWorkerCrash);
    this.processor = new EnvelopeProcessor(
        stepClock,
        clock,
        factory,
        new BranchAStage(reasoner, branchExecutor, metrics),
        new BranchBStage(reasoner, branchExecutor, metrics),
        new IntegrationStage(reasoner, clock, metrics),
        settings.batchPolicy());
  }

  /**
   * Launches the dispatch loop.
   *
   * @throws PipelineStateException {@code ALREADY_RUNNING} when running, {@code TERMINATED} after stop
   */
  public void start() {
    if (!lifecycle.compareAndSet(Lifecycle.NEW, Lifecycle.RUNNING)) {
      if (lifecycle.get() == Lifecycle.RUNNING) {
        throw new PipelineStateException(PipelineStateException.Kind.ALREADY_RUNNING, "pipeline already running");
      }
      throw new PipelineStateException(
          PipelineStateException.Kind.TERMINATED, "pipeline was stopped and cannot be restarted");
    }
    dispatchExecutor.execute(this::dispatchLoop);
    log.info("Pipeline started (inputCapacity={}, outputCapacity={}, maxInFlight={}, batchPolicy={})",
        settings.inputQueueCapacity(),
        settings.outputQueueCapacity(),
        settings.maxInFlight(),
        settings.batchPolicy());
  }

  /**
   * Fires the cancellation signal and returns without waiting for in-flight envelopes.
   *
   * @throws PipelineStateException {@code NOT_RUNNING} when the controller is not running
   */
  public void stop() {
    if (!lifecycle.compareAndSet(Lifecycle.RUNNING, Lifecycle.STOPPED)) {
      throw new PipelineStateException(PipelineStateException.Kind.NOT_RUNNING, "pipeline not running");
    }
    stopRequested.set(true);
    dispatchExecutor.shutdown();
    log.info("Pipeline stop requested; {} envelope(s) in flight", inFlight.size());
    shutdownPoolsIfDrained();
  }

  public boolean isRunning() {
    return lifecycle.get() == Lifecycle.RUNNING;
  }

  /**
   * Enqueues {@code envelope} without blocking. Allowed before {@link #start()}.
   *
   * @param envelope envelope to process
   * @throws SubmissionRejectedException when stopped, when the input queue is full, when an envelope
   *     with the same id is in flight, or when one of its payloads was submitted before
   */
  public void submit(Envelope envelope) throws SubmissionRejectedException {
    Objects.requireNonNull(envelope, "envelope");
    String id = envelope.id();
    if (stopRequested.get()) {
      throw rejectStopped(id);
    }
    if (inFlight.putIfAbsent(id, envelope) != null) {
      throw new SubmissionRejectedException(
          SubmissionRejectedException.Reason.DUPLICATE_ID, id, "envelope " + id + " already in flight");
    }
    Payload reused = claimPayloads(envelope);
    if (reused != null) {
      inFlight.remove(id, envelope);
      metricsPort.increment("pipeline.submit.rejected.payloadReused");
      throw new SubmissionRejectedException(SubmissionRejectedException.Reason.PAYLOAD_REUSED, id,
          "payload " + reused.id() + " was already submitted");
    }
    if (!inputQueue.offer(envelope)) {
      releaseClaims(envelope);
      inFlight.remove(id, envelope);
      metricsPort.increment("pipeline.submit.rejected.queueFull");
      throw new SubmissionRejectedException(
          SubmissionRejectedException.Reason.QUEUE_FULL, id, "input queue full");
    }
    if (stopRequested.get() && inputQueue.remove(envelope)) {
      releaseClaims(envelope);
      inFlight.remove(id, envelope);
      signalDrained();
      shutdownPoolsIfDrained();
      throw rejectStopped(id);
    }
    metricsPort.increment("pipeline.submit.accepted");
    metricsPort.observe("pipeline.inflight", inFlight.size());
  }

  public Envelope submitToken(String content, TokenKind kind, String source, int priority)
      throws SubmissionRejectedException {
    Token token = factory.token(content, kind, source);
    log.debug("Submitting token {} ({}): {}", token.id(), kind, Logs.truncate(content, LOG_PREVIEW_CHARS));
    return submitAndReturn(factory.forToken(token, priority));
  }

  public Envelope submitGraph(Graph graph, int priority) throws SubmissionRejectedException {
    return submitAndReturn(factory.forGraph(graph, priority));
  }

  public Envelope submitTokenBatch(List<Token> tokens, int priority) throws SubmissionRejectedException {
    return submitAndReturn(factory.forTokens(tokens, priority));
  }

  public Envelope submitGraphBatch(List<Graph> graphs, int priority) throws SubmissionRejectedException {
    return submitAndReturn(factory.forGraphs(graphs, priority));
  }

  /**
   * Returns the factory this controller uses, for callers building payloads up front.
   *
   * @return envelope factory
   */
  public EnvelopeFactory factory() {
    return factory;
  }

  /**
   * Returns the read side of the output queue.
   *
   * @return output view
   */
  public EnvelopeOutput output() {
    return output;
  }

  /**
   * Returns a copy of the aggregated metrics.
   *
   * @return metrics snapshot
   */
  public MetricsSnapshot metrics() {
    return metrics.snapshot();
  }

  /**
   * Returns the number of envelopes accepted and not yet emitted or abandoned.
   *
   * @return in-flight count
   */
  public int inFlightCount() {
    return inFlight.size();
  }

  /**
   * Waits until no envelope is in flight.
   *
   * @param timeout maximum wait
   * @return {@code true} when drained within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitQuiescence(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (drainMonitor) {
      while (!inFlight.isEmpty()) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return false;
        }
        TimeUnit.NANOSECONDS.timedWait(drainMonitor, remaining);
      }
      return true;
    }
  }

  private Envelope submitAndReturn(Envelope envelope) throws SubmissionRejectedException {
    submit(envelope);
    return envelope;
  }

  /**
   * Claims every payload of {@code envelope}, rolling back on the first one already claimed.
   *
   * @return the payload that could not be claimed, or {@code null} when all were claimed
   */
  private static Payload claimPayloads(Envelope envelope) {
    List<? extends Payload> payloads = envelope.payloads();
    for (int i = 0; i < payloads.size(); i++) {
      if (!payloads.get(i).claim()) {
        for (int j = 0; j < i; j++) {
          payloads.get(j).releaseClaim();
        }
        return payloads.get(i);
      }
    }
    return null;
  }

  private static void releaseClaims(Envelope envelope) {
    for (Payload payload : envelope.payloads()) {
      payload.releaseClaim();
    }
  }

  private SubmissionRejectedException rejectStopped(String id) {
    metricsPort.increment("pipeline.submit.rejected.stopped");
    return new SubmissionRejectedException(SubmissionRejectedException.Reason.STOPPED, id, "pipeline stopped");
  }

  private void dispatchLoop() {
    log.debug("Dispatch loop running");
    try {
      while (!stopRequested.get()) {
        Envelope envelope = inputQueue.poll(DISPATCH_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (envelope == null) {
          continue;
        }
        if (!acquirePermit()) {
          abandon(envelope);
          break;
        }
        try {
          envelopeExecutor.execute(() -> runEnvelope(envelope));
        } catch (RejectedExecutionException ex) {
          permits.release();
          log.warn("Envelope pool rejected {}", envelope.id());
          abandon(envelope);
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Dispatch loop interrupted");
    } finally {
      Envelope queued;
      while ((queued = inputQueue.poll()) != null) {
        abandon(queued);
      }
      envelopeExecutor.shutdown();
      shutdownPoolsIfDrained();
      log.info("Dispatch loop exited");
    }
  }

  private boolean acquirePermit() throws InterruptedException {
    while (!permits.tryAcquire(DISPATCH_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
      if (stopRequested.get()) {
        return false;
      }
    }
    if (stopRequested.get()) {
      permits.release();
      return false;
    }
    return true;
  }

  private void runEnvelope(Envelope envelope) {
    MDC.put(MDC_ENVELOPE, envelope.id());
    long started = System.nanoTime();
    try {
      processor.process(envelope, cancellation);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      recordProcessorFailure(envelope, "interrupted while joining branch tasks");
    } catch (RuntimeException ex) {
      log.error("Envelope {} processing failed", envelope.id(), ex);
      recordProcessorFailure(envelope, ex.toString());
    } finally {
      try {
        finish(envelope, System.nanoTime() - started);
      } finally {
        permits.release();
        MDC.remove(MDC_ENVELOPE);
      }
    }
  }

  private void finish(Envelope envelope, long latencyNanos) {
    envelope.exit(exitStep(envelope), clock.nowMillis());
    metrics.recordEnvelope(envelope.kind(), latencyNanos, envelope.hasErrors());
    if (outputQueue.offer(envelope)) {
      log.debug("Envelope {} emitted with route {}", envelope.id(), envelope.route());
    } else {
      metrics.recordOutputDrop();
      log.warn("Output queue full; dropped envelope {}", envelope.id());
    }
    // Removed last: awaitQuiescence must observe the emit or drop.
    inFlight.remove(envelope.id(), envelope);
    metricsPort.observe("pipeline.inflight", inFlight.size());
    signalDrained();
    shutdownPoolsIfDrained();
  }

  private int exitStep(Envelope envelope) {
    try {
      return stepClock.currentStep();
    } catch (RuntimeException ex) {
      log.warn("Step clock unavailable at exit of {}; using entry step", envelope.id(), ex);
      return envelope.entryStep();
    }
  }

  private void recordProcessorFailure(Envelope envelope, String message) {
    envelope.recordError(
        new PayloadError(clock.nowMillis(), "processor", ErrorKind.PROCESSOR, envelope.entryStep(), message));
    boolean batch = envelope.content().isBatch();
    for (Payload payload : envelope.payloads()) {
      PipelineState state = payload.state();
      // Batch items never attempted stay QUEUED.
      if (!state.isTerminal() && !(batch && state == PipelineState.QUEUED)) {
        payload.transitionTo(PipelineState.FAILED);
      }
    }
  }

  private void abandon(Envelope envelope) {
    inFlight.remove(envelope.id(), envelope);
    log.debug("Envelope {} abandoned by stop", envelope.id());
    signalDrained();
  }

  private void signalDrained() {
    synchronized (drainMonitor) {
      drainMonitor.notifyAll();
    }
  }

  private void shutdownPoolsIfDrained() {
    if (stopRequested.get() && inFlight.isEmpty()) {
      envelopeExecutor.shutdown();
      branchExecutor.shutdown();
    }
  }

  private void handleWorkerCrash(Thread thread, Throwable throwable) {
    metricsPort.increment("pipeline.worker.uncaught");
    log.error("Pipeline worker {} crashed", thread.getName(), throwable);
  }
}
