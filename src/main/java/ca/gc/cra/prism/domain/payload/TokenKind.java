package ca.gc.cra.prism.domain.payload;

import java.util.Locale;

/** Category label attached to a token. */
public enum TokenKind {
  PERCEPT,
  THOUGHT,
  MEMORY,
  GOAL,
  ACTION,
  EMOTION,
  QUERY,
  RESPONSE,
  INSIGHT,
  AFFORDANCE,
  SALIENCE;

  /**
   * Returns the lowercase label used in prompts, e.g. {@code percept}.
   *
   * @return prompt label
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
