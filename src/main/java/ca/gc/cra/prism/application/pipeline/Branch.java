package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.domain.stage.Perspective;
import ca.gc.cra.prism.domain.stage.TemporalScope;

/**
 * Identifies one of the two fan-out stages for routing, logging and metrics.
 */
enum Branch {
  A("branchA", Perspective.WIDTH),
  B("branchB", TemporalScope.WIDTH);

  private final String routeName;
  private final int width;

  Branch(String routeName, int width) {
    this.routeName = routeName;
    this.width = width;
  }

  String routeName() {
    return routeName;
  }

  int width() {
    return width;
  }

  String errorMetric() {
    return "pipeline." + routeName + ".error";
  }
}
