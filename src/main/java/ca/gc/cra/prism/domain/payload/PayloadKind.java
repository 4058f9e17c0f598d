package ca.gc.cra.prism.domain.payload;

/**
 * Kind of content carried by an envelope; metrics count processed envelopes per kind.
 */
public enum PayloadKind {
  TOKEN,
  TOKEN_BATCH,
  GRAPH,
  GRAPH_BATCH
}
