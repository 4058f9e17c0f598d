package ca.gc.cra.prism.domain.clock;

/**
 * <strong>What:</strong> The two gating flags captured once when an envelope enters processing.
 * <p><strong>Why:</strong> Integration weighs branch outputs according to these flags; sampling them once
 * at entry keeps the decision stable for the lifetime of the envelope.</p>
 * <p><strong>Thread-safety:</strong> Immutable value.</p>
 *
 * @param holdA whether the Branch-A hold was active at entry
 * @param holdB whether the Branch-B hold was active at entry
 * @since 0.1.0
 */
public record GatingState(boolean holdA, boolean holdB) {
  /** Gating with neither hold active. */
  public static final GatingState NONE = new GatingState(false, false);
}
