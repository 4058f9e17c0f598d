package ca.gc.cra.prism.domain.payload;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> The work carried by an envelope: one token, one graph, or a batch of either.
 * <p><strong>Role:</strong> Closed set of content variants; processing dispatches on {@link #isBatch()}.</p>
 *
 * @since 0.1.0
 */
public sealed interface EnvelopeContent
    permits EnvelopeContent.SingleToken,
        EnvelopeContent.TokenBatch,
        EnvelopeContent.SingleGraph,
        EnvelopeContent.GraphBatch {

  PayloadKind kind();

  /**
   * Returns the payloads in processing order.
   *
   * @return immutable list of payloads
   */
  List<? extends Payload> payloads();

  default boolean isBatch() {
    return kind() == PayloadKind.TOKEN_BATCH || kind() == PayloadKind.GRAPH_BATCH;
  }

  /** One token. */
  record SingleToken(Token token) implements EnvelopeContent {
    public SingleToken {
      Objects.requireNonNull(token, "token");
    }

    @Override
    public PayloadKind kind() {
      return PayloadKind.TOKEN;
    }

    @Override
    public List<Token> payloads() {
      return List.of(token);
    }
  }

  /** Ordered tokens processed sequentially. */
  record TokenBatch(List<Token> tokens) implements EnvelopeContent {
    public TokenBatch {
      tokens = List.copyOf(tokens);
      requireDistinct(tokens);
    }

    @Override
    public PayloadKind kind() {
      return PayloadKind.TOKEN_BATCH;
    }

    @Override
    public List<Token> payloads() {
      return tokens;
    }
  }

  /** One graph. */
  record SingleGraph(Graph graph) implements EnvelopeContent {
    public SingleGraph {
      Objects.requireNonNull(graph, "graph");
    }

    @Override
    public PayloadKind kind() {
      return PayloadKind.GRAPH;
    }

    @Override
    public List<Graph> payloads() {
      return List.of(graph);
    }
  }

  /** Ordered graphs processed sequentially. */
  record GraphBatch(List<Graph> graphs) implements EnvelopeContent {
    public GraphBatch {
      graphs = List.copyOf(graphs);
      requireDistinct(graphs);
    }

    @Override
    public PayloadKind kind() {
      return PayloadKind.GRAPH_BATCH;
    }

    @Override
    public List<Graph> payloads() {
      return graphs;
    }
  }

  /**
   * Rejects batches listing the same payload id twice; each item owns its own slots.
   *
   * @param payloads batch items
   * @throws IllegalArgumentException on a repeated id
   */
  private static void requireDistinct(List<? extends Payload> payloads) {
    Set<String> seen = new HashSet<>();
    for (Payload payload : payloads) {
      if (!seen.add(payload.id())) {
        throw new IllegalArgumentException("payload " + payload.id() + " appears more than once in batch");
      }
    }
  }

  /**
   * Wraps a single payload in its single-item variant.
   *
   * @param payload token or graph
   * @return matching single-item content
   */
  static EnvelopeContent single(Payload payload) {
    if (payload instanceof Token token) {
      return new SingleToken(token);
    }
    if (payload instanceof Graph graph) {
      return new SingleGraph(graph);
    }
    throw new IllegalArgumentException("unsupported payload type " + payload.getClass().getName());
  }
}
