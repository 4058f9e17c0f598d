package ca.gc.cra.prism.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.domain.payload.Envelope;
import ca.gc.cra.prism.domain.payload.Token;
import ca.gc.cra.prism.domain.payload.TokenKind;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class PipelineControllerLifecycleTest {
  private final RecordingMetricsPort metricsPort = new RecordingMetricsPort();
  private PipelineController controller;

  @AfterEach
  void tearDown() {
    if (controller != null && controller.isRunning()) {
      controller.stop();
    }
  }

  @Test
  void startTwiceIsRejected() {
    controller = newController(new PipelineSettings(4, 4, 1, BatchPolicy.FAIL_FAST));
    controller.start();

    PipelineStateException ex = assertThrows(PipelineStateException.class, controller::start);
    assertEquals(PipelineStateException.Kind.ALREADY_RUNNING, ex.kind());
    assertTrue(controller.isRunning());
  }

  @Test
  void stopBeforeStartIsRejected() {
    controller = newController(PipelineSettings.defaults());

    PipelineStateException ex = assertThrows(PipelineStateException.class, controller::stop);
    assertEquals(PipelineStateException.Kind.NOT_RUNNING, ex.kind());
  }

  @Test
  void stoppedControllerCannotRestartOrStopAgain() {
    controller = newController(PipelineSettings.defaults());
    controller.start();
    controller.stop();

    assertFalse(controller.isRunning());
    assertEquals(PipelineStateException.Kind.TERMINATED,
        assertThrows(PipelineStateException.class, controller::start).kind());
    assertEquals(PipelineStateException.Kind.NOT_RUNNING,
        assertThrows(PipelineStateException.class, controller::stop).kind());
  }

  @Test
  void submitAfterStopIsRejected() {
    controller = newController(PipelineSettings.defaults());
    controller.start();
    controller.stop();

    SubmissionRejectedException ex = assertThrows(SubmissionRejectedException.class,
        () -> controller.submitToken("late", TokenKind.PERCEPT, "test", 0));
    assertEquals(SubmissionRejectedException.Reason.STOPPED, ex.reason());
    assertEquals(1, metricsPort.count("pipeline.submit.rejected.stopped"));
  }

  @Test
  void fullInputQueueRejectsWithoutBlocking() throws Exception {
    controller = newController(new PipelineSettings(2, 4, 1, BatchPolicy.FAIL_FAST));
    controller.submitToken("one", TokenKind.PERCEPT, "test", 0);
    controller.submitToken("two", TokenKind.PERCEPT, "test", 0);

    SubmissionRejectedException ex = assertThrows(SubmissionRejectedException.class,
        () -> controller.submitToken("three", TokenKind.PERCEPT, "test", 0));

    assertEquals(SubmissionRejectedException.Reason.QUEUE_FULL, ex.reason());
    assertEquals(2, controller.inFlightCount());
    assertEquals(2, metricsPort.count("pipeline.submit.accepted"));
    assertEquals(1, metricsPort.count("pipeline.submit.rejected.queueFull"));
  }

  @Test
  void duplicateIdInFlightIsRejected() throws Exception {
    controller = newController(PipelineSettings.defaults());
    EnvelopeFactory factory = controller.factory();
    Envelope envelope = factory.forToken(factory.token("dup", TokenKind.PERCEPT, "test"), 0);
    controller.submit(envelope);

    SubmissionRejectedException ex =
        assertThrows(SubmissionRejectedException.class, () -> controller.submit(envelope));
    assertEquals(SubmissionRejectedException.Reason.DUPLICATE_ID, ex.reason());
    assertEquals(envelope.id(), ex.envelopeId());
    assertEquals(1, controller.inFlightCount());
  }

  @Test
  void processedPayloadCannotBeResubmitted() throws Exception {
    ScriptedReasoner reasoner = new ScriptedReasoner();
    controller = new PipelineController(PipelineSettings.defaults(), reasoner,
        new FixedStepClock(1, false, false), ClockPort.SYSTEM, metricsPort);
    controller.start();
    EnvelopeFactory factory = controller.factory();
    Token token = factory.token("once", TokenKind.PERCEPT, "test");
    controller.submit(factory.forToken(token, 0));
    assertNotNull(controller.output().poll(Duration.ofSeconds(10)));
    assertTrue(controller.awaitQuiescence(Duration.ofSeconds(10)));

    Envelope again = factory.forToken(token, 0);
    SubmissionRejectedException ex =
        assertThrows(SubmissionRejectedException.class, () -> controller.submit(again));

    assertEquals(SubmissionRejectedException.Reason.PAYLOAD_REUSED, ex.reason());
    assertEquals(again.id(), ex.envelopeId());
    assertTrue(ex.getMessage().contains(token.id()));
    assertEquals(0, controller.inFlightCount());
    assertEquals(1, metricsPort.count("pipeline.submit.rejected.payloadReused"));
    assertEquals(18, reasoner.calls().size());
    assertTrue(token.integrated().isPresent());
  }

  @Test
  void payloadQueuedInAnotherEnvelopeIsRejectedAndClaimsRollBack() throws Exception {
    controller = newController(PipelineSettings.defaults());
    EnvelopeFactory factory = controller.factory();
    Token shared = factory.token("shared", TokenKind.PERCEPT, "test");
    Token fresh = factory.token("fresh", TokenKind.PERCEPT, "test");
    controller.submit(factory.forToken(shared, 0));

    SubmissionRejectedException ex = assertThrows(SubmissionRejectedException.class,
        () -> controller.submit(factory.forTokens(List.of(fresh, shared), 0)));

    assertEquals(SubmissionRejectedException.Reason.PAYLOAD_REUSED, ex.reason());
    assertEquals(1, controller.inFlightCount());
    controller.submit(factory.forToken(fresh, 0));
    assertEquals(2, controller.inFlightCount());
  }

  @Test
  void batchListingSamePayloadTwiceIsRejected() throws Exception {
    controller = newController(PipelineSettings.defaults());
    Token token = controller.factory().token("twice", TokenKind.PERCEPT, "test");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> controller.submitTokenBatch(List.of(token, token), 0));

    assertTrue(ex.getMessage().contains(token.id()));
    assertEquals(0, controller.inFlightCount());
    controller.submit(controller.factory().forToken(token, 0));
    assertEquals(1, controller.inFlightCount());
  }

  @Test
  void queueFullRejectionLeavesPayloadSubmittable() throws Exception {
    controller = newController(new PipelineSettings(1, 4, 1, BatchPolicy.FAIL_FAST));
    EnvelopeFactory factory = controller.factory();
    controller.submitToken("first", TokenKind.PERCEPT, "test", 0);
    Token token = factory.token("retry", TokenKind.PERCEPT, "test");

    assertEquals(SubmissionRejectedException.Reason.QUEUE_FULL, assertThrows(SubmissionRejectedException.class,
        () -> controller.submit(factory.forToken(token, 0))).reason());

    assertTrue(token.claim());
  }

  @Test
  void stopAbandonsQueuedEnvelopes() throws Exception {
    ScriptedReasoner reasoner = new ScriptedReasoner().hold();
    controller = new PipelineController(new PipelineSettings(8, 8, 1, BatchPolicy.FAIL_FAST),
        reasoner, new FixedStepClock(1, false, false), ClockPort.SYSTEM, metricsPort);
    controller.submitToken("first", TokenKind.PERCEPT, "test", 0);
    controller.submitToken("second", TokenKind.PERCEPT, "test", 0);
    controller.submitToken("third", TokenKind.PERCEPT, "test", 0);
    controller.start();
    awaitCalls(reasoner, 1);

    controller.stop();
    reasoner.release();

    assertTrue(controller.awaitQuiescence(Duration.ofSeconds(10)));
    assertEquals(0, controller.inFlightCount());
    Envelope emitted = controller.output().poll(Duration.ofSeconds(5));
    assertNotNull(emitted);
    assertNull(controller.output().poll(Duration.ofMillis(200)));
  }

  @Test
  void awaitQuiescenceTimesOutWhileWorkIsPending() throws Exception {
    controller = newController(PipelineSettings.defaults());
    controller.submitToken("pending", TokenKind.PERCEPT, "test", 0);

    assertFalse(controller.awaitQuiescence(Duration.ofMillis(100)));
  }

  private PipelineController newController(PipelineSettings settings) {
    return new PipelineController(
        settings, new ScriptedReasoner(), new FixedStepClock(1, false, false), ClockPort.SYSTEM, metricsPort);
  }

  static void awaitCalls(ScriptedReasoner reasoner, int count) throws InterruptedException {
    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (reasoner.calls().size() < count) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("expected " + count + " reasoner calls, saw " + reasoner.calls().size());
      }
      Thread.sleep(10);
    }
  }
}
