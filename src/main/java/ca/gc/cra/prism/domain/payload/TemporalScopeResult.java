package ca.gc.cra.prism.domain.payload;

import ca.gc.cra.prism.domain.stage.TemporalScope;
import java.util.Objects;

/**
 * Branch-B output for one cell of the temporal/scope grid.
 *
 * @param index slot index in {@code [0, 8]}
 * @param descriptorName cell name, e.g. {@code Present-Relational}
 * @param temporal temporal axis value
 * @param scope scope axis value
 * @param row grid row
 * @param column grid column
 * @param text Reasoner output
 * @param weight integration weight of the cell
 */
public record TemporalScopeResult(
    int index,
    String descriptorName,
    TemporalScope.Temporal temporal,
    TemporalScope.Scope scope,
    int row,
    int column,
    String text,
    double weight) implements BranchResult {
  /** Every cell carries an equal share. */
  public static final double DEFAULT_WEIGHT = 1.0d / TemporalScope.WIDTH;

  public TemporalScopeResult {
    Objects.requireNonNull(descriptorName, "descriptorName");
    Objects.requireNonNull(temporal, "temporal");
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(text, "text");
  }
}
