package ca.gc.cra.prism.domain.payload;

import java.util.Locale;

/** Category label attached to a graph. */
public enum GraphKind {
  CAUSAL,
  SEMANTIC,
  TEMPORAL,
  SPATIAL,
  HIERARCHICAL,
  ASSOCIATIVE,
  INFERENTIAL,
  GOAL_TREE;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
