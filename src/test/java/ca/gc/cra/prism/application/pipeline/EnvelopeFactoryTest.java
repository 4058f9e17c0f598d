package ca.gc.cra.prism.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.domain.clock.ClockState;
import ca.gc.cra.prism.domain.payload.Envelope;
import ca.gc.cra.prism.domain.payload.GraphKind;
import ca.gc.cra.prism.domain.payload.PayloadKind;
import ca.gc.cra.prism.domain.payload.PipelineState;
import ca.gc.cra.prism.domain.payload.Token;
import ca.gc.cra.prism.domain.payload.TokenKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class EnvelopeFactoryTest {
  private final EnvelopeFactory factory = new EnvelopeFactory(() -> 42L);

  @Test
  void idsCarryPrefixAndAreUnique() {
    Token first = factory.token("a", TokenKind.PERCEPT, "test");
    Token second = factory.token("a", TokenKind.PERCEPT, "test");

    assertTrue(first.id().matches("tok-\\d+-\\d+"), first.id());
    assertNotEquals(first.id(), second.id());
    assertTrue(factory.graph(GraphKind.SEMANTIC, List.of(), List.of(), null).id().startsWith("grp-"));
    assertTrue(factory.forToken(first, 0).id().startsWith("env-"));
  }

  @Test
  void envelopesStartQueuedWithCreationTime() {
    Envelope envelope = factory.forTokens(
        List.of(factory.token("a", TokenKind.PERCEPT, "t"), factory.token("b", TokenKind.PERCEPT, "t")), 7);

    assertEquals(PayloadKind.TOKEN_BATCH, envelope.kind());
    assertEquals(7, envelope.priority());
    assertEquals(42L, envelope.createdAtMillis());
    assertTrue(envelope.payloads().stream().allMatch(p -> p.state() == PipelineState.QUEUED));
  }

  @Test
  void childInheritsEntrySnapshotAndStage() {
    Token second = factory.token("b", TokenKind.GOAL, "t");
    Envelope batch = factory.forTokens(List.of(factory.token("a", TokenKind.GOAL, "t"), second), 3);
    batch.enter(new ClockState(20, true, false), "Execution");

    Envelope child = factory.childOf(batch, 1, second);

    assertEquals(batch.id() + "[1]", child.id());
    assertEquals(PayloadKind.TOKEN, child.kind());
    assertEquals(3, child.priority());
    assertEquals("Execution", child.stage());
    assertEquals(batch.entryState(), child.entryState());
  }
}
