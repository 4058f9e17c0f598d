package ca.gc.cra.prism.domain.stage;

import java.util.List;
import java.util.Set;

/**
 * <strong>What:</strong> Maps a captured clock step to the name of the phase that owns it.
 * <p><strong>Why:</strong> Envelopes are labelled with their phase on entry so consumers can see where
 * in the cycle a payload was admitted.</p>
 * <p><strong>Role:</strong> Pure domain function over a static table of five six-step phases.</p>
 * <p><strong>Thread-safety:</strong> Stateless; the table is immutable.</p>
 * <p><strong>Performance:</strong> Linear scan over 30 entries.</p>
 *
 * @since 0.1.0
 */
public final class StageRouter {
  /** Returned when no table entry contains the step. */
  public static final String UNKNOWN = "unknown";

  private static final List<StageDefinition> TABLE = List.of(
      new StageDefinition(1, "Perception", Set.of(1, 2, 3, 4, 5, 6),
          "Gather and process input from the environment"),
      new StageDefinition(2, "Analysis", Set.of(7, 8, 9, 10, 11, 12),
          "Analyze inputs and identify patterns"),
      new StageDefinition(3, "Planning", Set.of(13, 14, 15, 16, 17, 18),
          "Generate and evaluate plans"),
      new StageDefinition(4, "Execution", Set.of(19, 20, 21, 22, 23, 24),
          "Execute selected actions"),
      new StageDefinition(5, "Integration", Set.of(25, 26, 27, 28, 29, 30),
          "Integrate results and update knowledge"));

  private StageRouter() {
    // Utility
  }

  /**
   * Returns the phase name for {@code step}.
   *
   * @param step clock step captured at envelope entry
   * @return phase name, or {@link #UNKNOWN} when the step is outside the table
   */
  public static String determineStage(int step) {
    for (StageDefinition stage : TABLE) {
      if (stage.steps().contains(step)) {
        return stage.name();
      }
    }
    return UNKNOWN;
  }

  /**
   * Returns the static routing table in phase order.
   *
   * @return immutable list of phase definitions
   */
  public static List<StageDefinition> table() {
    return TABLE;
  }

  /**
   * One row of the routing table.
   *
   * @param id one-based phase number
   * @param name phase name recorded on envelopes
   * @param steps clock steps owned by the phase
   * @param description short description of the phase
   */
  public record StageDefinition(int id, String name, Set<Integer> steps, String description) {
    public StageDefinition {
      steps = Set.copyOf(steps);
    }
  }
}
