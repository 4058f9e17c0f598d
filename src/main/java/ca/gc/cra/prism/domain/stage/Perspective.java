package ca.gc.cra.prism.domain.stage;

/**
 * <strong>What:</strong> The eight static descriptors driving the Branch-A fan-out.
 * <p><strong>Why:</strong> Each Branch-A task is parameterized by exactly one descriptor; the ordinal
 * doubles as the slot index in the payload's Branch-A result array.</p>
 * <p><strong>Role:</strong> Domain constant table consumed by the Branch-A stage and prompt templates.</p>
 * <p>The descriptors span three binary axes (perception/expression, action/reflection,
 * learning/integration); the binary code spells out the axis bits in that order.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum Perspective {
  PERCEPTION_ACTION_LEARNING(
      "000",
      "Perception-Action-Learning",
      "Direct sensory processing with immediate action and learning"),
  PERCEPTION_ACTION_INTEGRATION(
      "001",
      "Perception-Action-Integration",
      "Direct sensory processing with immediate action and knowledge integration"),
  PERCEPTION_REFLECTION_LEARNING(
      "010",
      "Perception-Reflection-Learning",
      "Direct sensory processing with reflective analysis and learning"),
  PERCEPTION_REFLECTION_INTEGRATION(
      "011",
      "Perception-Reflection-Integration",
      "Direct sensory processing with reflective analysis and integration"),
  EXPRESSION_ACTION_LEARNING(
      "100",
      "Expression-Action-Learning",
      "Generative output with immediate action and learning"),
  EXPRESSION_ACTION_INTEGRATION(
      "101",
      "Expression-Action-Integration",
      "Generative output with immediate action and integration"),
  EXPRESSION_REFLECTION_LEARNING(
      "110",
      "Expression-Reflection-Learning",
      "Generative output with reflective analysis and learning"),
  EXPRESSION_REFLECTION_INTEGRATION(
      "111",
      "Expression-Reflection-Integration",
      "Generative output with reflective analysis and integration");

  /** Fan-out width of Branch-A. */
  public static final int WIDTH = 8;

  private final String binaryCode;
  private final String displayName;
  private final String description;

  Perspective(String binaryCode, String displayName, String description) {
    this.binaryCode = binaryCode;
    this.displayName = displayName;
    this.description = description;
  }

  /**
   * Returns the slot index used for this descriptor.
   *
   * @return index in {@code [0, 7]}
   */
  public int index() {
    return ordinal();
  }

  /**
   * Returns the three-bit axis code, e.g. {@code "010"}.
   *
   * @return binary code string
   */
  public String binaryCode() {
    return binaryCode;
  }

  /**
   * Returns the descriptor name recorded on branch results.
   *
   * @return human-readable descriptor name
   */
  public String displayName() {
    return displayName;
  }

  /**
   * Returns a one-line description passed to the Reasoner.
   *
   * @return descriptor description
   */
  public String description() {
    return description;
  }
}
