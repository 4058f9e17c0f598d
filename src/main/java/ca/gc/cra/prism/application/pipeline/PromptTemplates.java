package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.domain.clock.ClockState;
import ca.gc.cra.prism.domain.payload.BranchResult;
import ca.gc.cra.prism.domain.payload.Graph;
import ca.gc.cra.prism.domain.payload.IntegrationFocus;
import ca.gc.cra.prism.domain.payload.Payload;
import ca.gc.cra.prism.domain.payload.Token;
import ca.gc.cra.prism.domain.stage.Perspective;
import ca.gc.cra.prism.domain.stage.TemporalScope;
import java.util.List;
import java.util.Locale;

/**
 * Prompt text for branch and integration Reasoner calls.
 */
final class PromptTemplates {
  static final int TOKEN_BRANCH_MAX_TOKENS = 150;
  static final int GRAPH_BRANCH_MAX_TOKENS = 200;
  static final int INTEGRATION_MAX_TOKENS = 300;

  static final String FOCUS_BRANCH_B_ONLY =
      "Focus on the temporal-scope insights, as the perspective stream is held.";
  static final String FOCUS_BRANCH_A_ONLY =
      "Focus on the perspective insights, as the temporal-scope stream is held.";
  static final String FOCUS_EQUAL = "Integrate both perspective and temporal-scope streams equally.";

  private PromptTemplates() {}

  static int branchMaxTokens(Payload payload) {
    return payload instanceof Graph ? GRAPH_BRANCH_MAX_TOKENS : TOKEN_BRANCH_MAX_TOKENS;
  }

  static String perspectiveSystem(Perspective perspective, Payload payload) {
    if (payload instanceof Graph) {
      return String.format(Locale.ROOT,
          "You are analyzing a graph from the %s perspective.%n"
              + "Binary code: %s%n"
              + "Description: %s%n%n"
              + "Analyze the graph structure and suggest modifications or insights from this perspective.%n"
              + "Consider how nodes and edges relate to this angle.",
          perspective.displayName(), perspective.binaryCode(), perspective.description());
    }
    return String.format(Locale.ROOT,
        "You are processing content from the %s perspective.%n"
            + "Binary code: %s%n"
            + "Description: %s%n%n"
            + "Analyze the input and provide insights from this specific angle.%n"
            + "Be concise but insightful.",
        perspective.displayName(), perspective.binaryCode(), perspective.description());
  }

  static String temporalScopeSystem(TemporalScope cell, Payload payload) {
    String subject = payload instanceof Graph ? "a graph" : "content";
    return String.format(Locale.ROOT,
        "You are analyzing %s from the %s perspective.%n"
            + "Description: %s%n%n"
            + "Analyze the input through this specific lens:%n"
            + "- %s: %s%n"
            + "- %s: %s%n%n"
            + "Be concise but insightful.",
        subject,
        cell.displayName(),
        cell.description(),
        cell.temporal().label(), cell.temporal().guidance(),
        cell.scope().label(), cell.scope().guidance());
  }

  /**
   * Returns the user prompt shared by both branch stages.
   */
  static String branchPrompt(Payload payload) {
    if (payload instanceof Token token) {
      return String.format(Locale.ROOT, "Content type: %s\nContent: %s\nSalience: %.2f\nRelevance: %.2f",
          token.tokenKind().label(), token.content(), token.salience(), token.relevance());
    }
    Graph graph = (Graph) payload;
    return "Graph type: " + graph.graphKind().label() + "\n" + graph.describe();
  }

  static String focusInstruction(IntegrationFocus focus) {
    return switch (focus) {
      case BRANCH_B_ONLY -> FOCUS_BRANCH_B_ONLY;
      case BRANCH_A_ONLY -> FOCUS_BRANCH_A_ONLY;
      case EQUAL -> FOCUS_EQUAL;
    };
  }

  static String integrationSystem(ClockState entry, IntegrationFocus focus) {
    return String.format(Locale.ROOT,
        "You are integrating parallel analyses into one result.%n"
            + "Current state: Step %d, holdA=%s, holdB=%s%n"
            + "%s%n%n"
            + "Synthesize the parallel results into a coherent understanding.%n"
            + "Identify key insights, contradictions, and emergent patterns.",
        entry.step(), entry.holdA(), entry.holdB(), focusInstruction(focus));
  }

  static String integrationPrompt(Payload payload, String perspectiveSummary, String temporalScopeSummary) {
    return "PERSPECTIVE RESULTS:\n" + perspectiveSummary
        + "\nTEMPORAL-SCOPE RESULTS:\n" + temporalScopeSummary
        + "\nOriginal content: " + payload.summary()
        + "\n\nProvide an integrated synthesis.";
  }

  /**
   * Renders present results as one {@code [<descriptor>]: <text>} line each.
   */
  static String summarize(List<? extends BranchResult> results) {
    StringBuilder sb = new StringBuilder();
    for (BranchResult result : results) {
      sb.append('[').append(result.descriptorName()).append("]: ").append(result.text()).append('\n');
    }
    return sb.toString();
  }
}
