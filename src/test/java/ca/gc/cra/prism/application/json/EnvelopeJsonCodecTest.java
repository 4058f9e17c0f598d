package ca.gc.cra.prism.application.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.domain.clock.ClockState;
import ca.gc.cra.prism.domain.clock.GatingState;
import ca.gc.cra.prism.domain.payload.Envelope;
import ca.gc.cra.prism.domain.payload.EnvelopeContent;
import ca.gc.cra.prism.domain.payload.ErrorKind;
import ca.gc.cra.prism.domain.payload.Graph;
import ca.gc.cra.prism.domain.payload.GraphEdge;
import ca.gc.cra.prism.domain.payload.GraphKind;
import ca.gc.cra.prism.domain.payload.GraphNode;
import ca.gc.cra.prism.domain.payload.IntegratedResult;
import ca.gc.cra.prism.domain.payload.IntegrationFocus;
import ca.gc.cra.prism.domain.payload.PayloadError;
import ca.gc.cra.prism.domain.payload.PayloadKind;
import ca.gc.cra.prism.domain.payload.PerspectiveResult;
import ca.gc.cra.prism.domain.payload.PipelineState;
import ca.gc.cra.prism.domain.payload.StageSlots;
import ca.gc.cra.prism.domain.payload.TemporalScopeResult;
import ca.gc.cra.prism.domain.payload.Token;
import ca.gc.cra.prism.domain.payload.TokenKind;
import ca.gc.cra.prism.domain.stage.Perspective;
import ca.gc.cra.prism.domain.stage.TemporalScope;
import java.util.List;
import org.junit.jupiter.api.Test;

class EnvelopeJsonCodecTest {
  private final EnvelopeJsonCodec codec = new EnvelopeJsonCodec();

  @Test
  void processedTokenEnvelopeSurvivesRoundTrip() {
    Token token = new Token("tok-1", 10L, "hello \"world\"", TokenKind.QUERY, "mic", 0.9d, 0.4d, 0.8d, -0.25d);
    for (Perspective perspective : Perspective.values()) {
      if (perspective.ordinal() == 3) {
        token.branchA().fail(3, perspective.displayName(), new IllegalStateException("timeout"));
      } else {
        token.branchA().complete(perspective.ordinal(), new PerspectiveResult(perspective.ordinal(),
            perspective.displayName(), perspective.binaryCode(), "a" + perspective.ordinal(),
            PerspectiveResult.DEFAULT_CONFIDENCE));
      }
    }
    for (TemporalScope cell : TemporalScope.values()) {
      token.branchB().complete(cell.index(), new TemporalScopeResult(cell.index(), cell.displayName(),
          cell.temporal(), cell.scope(), cell.row(), cell.column(), "b" + cell.index(),
          TemporalScopeResult.DEFAULT_WEIGHT));
    }
    IntegratedResult integrated =
        new IntegratedResult(26, new GatingState(true, false), IntegrationFocus.BRANCH_B_ONLY, 7, 9, "folded\nresult");
    token.integrate(integrated);
    token.transitionTo(PipelineState.COMPLETED);

    Envelope envelope = new Envelope("env-1", new EnvelopeContent.SingleToken(token), 7, 5L);
    envelope.enter(new ClockState(26, true, false), "Integration");
    envelope.appendRoute("stage:Integration");
    envelope.appendRoute("branchA:partial");
    envelope.appendRoute("branchB:complete");
    envelope.appendRoute("integration:complete");
    PayloadError error = new PayloadError(42L, "batch[0]/integration", ErrorKind.INTEGRATION, 26, "slow");
    envelope.recordError(error);
    envelope.exit(27, 99L);

    String json = codec.encode(envelope);
    Envelope decoded = codec.decode(json);

    assertEquals("env-1", decoded.id());
    assertEquals(PayloadKind.TOKEN, decoded.kind());
    assertEquals(7, decoded.priority());
    assertEquals(5L, decoded.createdAtMillis());
    assertEquals("Integration", decoded.stage());
    assertEquals(new ClockState(26, true, false), decoded.entryState().orElseThrow());
    assertEquals(27, decoded.exitStep());
    assertEquals(99L, decoded.exitAtMillis());
    assertEquals(envelope.route(), decoded.route());
    assertEquals(List.of(error), decoded.errors());

    Token restored = (Token) decoded.payloads().get(0);
    assertEquals("tok-1", restored.id());
    assertEquals(10L, restored.createdAtMillis());
    assertEquals("hello \"world\"", restored.content());
    assertEquals(TokenKind.QUERY, restored.tokenKind());
    assertEquals("mic", restored.source());
    assertEquals(0.9d, restored.salience());
    assertEquals(-0.25d, restored.valence());
    assertEquals(PipelineState.COMPLETED, restored.state());
    assertEquals(token.branchA().results(), restored.branchA().results());
    assertEquals(token.branchB().results(), restored.branchB().results());
    StageSlots.SlotFailure failure = restored.branchA().failure(3).orElseThrow();
    assertEquals(Perspective.values()[3].displayName(), failure.descriptorName());
    assertEquals("timeout", failure.message());
    assertNull(failure.cause());
    assertEquals(integrated, restored.integrated().orElseThrow());

    assertEquals(json, codec.encode(decoded));
    assertFalse(restored.claim());
  }

  @Test
  void unprocessedGraphBatchKeepsStructureAndStaysSubmittable() {
    Graph graph = new Graph("grp-1", 3L, GraphKind.GOAL_TREE,
        List.of(new GraphNode("g", "goal", "goal", "ship", 1d), new GraphNode("s", "step", "task", "", 0.25d)),
        List.of(new GraphEdge("e1", "g", "s", "requires", 0.5d)),
        "g");
    Envelope envelope = new Envelope("env-2", new EnvelopeContent.GraphBatch(List.of(graph)), 0, 1L);

    Envelope decoded = codec.decode(codec.encode(envelope));

    assertEquals(PayloadKind.GRAPH_BATCH, decoded.kind());
    assertTrue(decoded.entryState().isEmpty());
    assertEquals(Envelope.UNASSIGNED_STAGE, decoded.stage());
    assertTrue(decoded.route().isEmpty());
    Graph restored = (Graph) decoded.payloads().get(0);
    assertEquals(GraphKind.GOAL_TREE, restored.graphKind());
    assertEquals(graph.nodes(), restored.nodes());
    assertEquals(graph.edges(), restored.edges());
    assertEquals("g", restored.rootNodeId());
    assertEquals(PipelineState.QUEUED, restored.state());
    assertTrue(restored.branchA().isEmpty());
    assertTrue(restored.integrated().isEmpty());
    assertTrue(restored.claim());
  }

  @Test
  void rejectsOtherSchemaVersions() {
    String json = codec.encode(tokenEnvelope()).replace("\"schemaVersion\":1", "\"schemaVersion\":2");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> codec.decode(json));
    assertEquals("unsupported envelope schema version 2", ex.getMessage());
  }

  @Test
  void rejectsPayloadsThatDoNotMatchKind() {
    String json = codec.encode(tokenEnvelope()).replace("\"kind\":\"TOKEN\"", "\"kind\":\"GRAPH\"");

    assertThrows(IllegalArgumentException.class, () -> codec.decode(json));
  }

  @Test
  void namesMissingFields() {
    String json = codec.encode(tokenEnvelope()).replace("\"id\":\"env-3\",", "");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> codec.decode(json));
    assertEquals("missing field 'id'", ex.getMessage());
  }

  @Test
  void rejectsSlotIndexOutsideStage() {
    Envelope envelope = tokenEnvelope();
    Token token = (Token) envelope.payloads().get(0);
    token.branchB().complete(8, new TemporalScopeResult(8, "Future-Relational", TemporalScope.Temporal.FUTURE,
        TemporalScope.Scope.RELATIONAL, 2, 2, "x", TemporalScopeResult.DEFAULT_WEIGHT));
    String json = codec.encode(envelope).replace("\"index\":8", "\"index\":12");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> codec.decode(json));
    assertEquals("branchB index 12 outside [0, 9)", ex.getMessage());
  }

  private static Envelope tokenEnvelope() {
    Token token = new Token("tok-3", 0L, "x", TokenKind.PERCEPT, "test");
    return new Envelope("env-3", new EnvelopeContent.SingleToken(token), 0, 0L);
  }
}
