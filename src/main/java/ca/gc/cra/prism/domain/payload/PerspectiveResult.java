package ca.gc.cra.prism.domain.payload;

import java.util.Objects;

/**
 * Branch-A output for one perspective descriptor.
 *
 * @param index slot index in {@code [0, 7]}
 * @param descriptorName perspective name
 * @param binaryCode three-bit axis code of the perspective
 * @param text Reasoner output
 * @param confidence fixed confidence attached to perspective outputs
 */
public record PerspectiveResult(int index, String descriptorName, String binaryCode, String text, double confidence)
    implements BranchResult {
  /** Confidence recorded on every perspective output. */
  public static final double DEFAULT_CONFIDENCE = 0.7d;

  public PerspectiveResult {
    Objects.requireNonNull(descriptorName, "descriptorName");
    Objects.requireNonNull(binaryCode, "binaryCode");
    Objects.requireNonNull(text, "text");
  }
}
