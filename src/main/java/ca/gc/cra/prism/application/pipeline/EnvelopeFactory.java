package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.domain.payload.Envelope;
import ca.gc.cra.prism.domain.payload.EnvelopeContent;
import ca.gc.cra.prism.domain.payload.Graph;
import ca.gc.cra.prism.domain.payload.GraphEdge;
import ca.gc.cra.prism.domain.payload.GraphKind;
import ca.gc.cra.prism.domain.payload.GraphNode;
import ca.gc.cra.prism.domain.payload.Payload;
import ca.gc.cra.prism.domain.payload.Token;
import ca.gc.cra.prism.domain.payload.TokenKind;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Creates tokens, graphs and the envelopes wrapping them.
 * <p><strong>Why:</strong> Centralizes id generation ({@code <prefix>-<nanos>-<counter>}) and creation
 * timestamps so every entry point produces envelopes the same way.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; the id counter is atomic.</p>
 *
 * @since 0.1.0
 */
public final class EnvelopeFactory {
  static final String TOKEN_PREFIX = "tok";
  static final String GRAPH_PREFIX = "grp";
  static final String ENVELOPE_PREFIX = "env";

  private final ClockPort clock;
  private final AtomicLong counter = new AtomicLong();

  public EnvelopeFactory(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Token token(String content, TokenKind kind, String source) {
    return new Token(nextId(TOKEN_PREFIX), clock.nowMillis(), content, kind, source);
  }

  public Graph graph(GraphKind kind, List<GraphNode> nodes, List<GraphEdge> edges, String rootNodeId) {
    return new Graph(nextId(GRAPH_PREFIX), clock.nowMillis(), kind, nodes, edges, rootNodeId);
  }

  public Envelope forToken(Token token, int priority) {
    return envelope(new EnvelopeContent.SingleToken(token), priority);
  }

  public Envelope forTokens(List<Token> tokens, int priority) {
    return envelope(new EnvelopeContent.TokenBatch(tokens), priority);
  }

  public Envelope forGraph(Graph graph, int priority) {
    return envelope(new EnvelopeContent.SingleGraph(graph), priority);
  }

  public Envelope forGraphs(List<Graph> graphs, int priority) {
    return envelope(new EnvelopeContent.GraphBatch(graphs), priority);
  }

  /**
   * Creates the sub-envelope used to process item {@code index} of a batch. The child inherits the
   * parent's priority, entry clock snapshot and stage, so the clock is not sampled again.
   *
   * @param parent batch envelope that already entered processing
   * @param index item position within the batch
   * @param payload batch item
   * @return single-item envelope
   */
  Envelope childOf(Envelope parent, int index, Payload payload) {
    Envelope child = new Envelope(
        parent.id() + "[" + index + "]", EnvelopeContent.single(payload), parent.priority(), clock.nowMillis());
    parent.entryState().ifPresent(state -> child.enter(state, parent.stage()));
    return child;
  }

  private Envelope envelope(EnvelopeContent content, int priority) {
    return new Envelope(nextId(ENVELOPE_PREFIX), content, priority, clock.nowMillis());
  }

  private String nextId(String prefix) {
    return String.format(Locale.ROOT, "%s-%d-%d", prefix, System.nanoTime(), counter.incrementAndGet());
  }
}
