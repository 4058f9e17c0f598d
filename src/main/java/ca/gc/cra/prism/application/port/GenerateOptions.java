package ca.gc.cra.prism.application.port;

import java.util.Objects;

/**
 * Generation parameters for one Reasoner call.
 *
 * @param systemPrompt system instruction framing the call
 * @param maxOutputTokens output length cap
 * @param temperature sampling temperature
 */
public record GenerateOptions(String systemPrompt, int maxOutputTokens, double temperature) {
  /** Temperature used by every pipeline call. */
  public static final double DEFAULT_TEMPERATURE = 0.7d;

  public GenerateOptions {
    Objects.requireNonNull(systemPrompt, "systemPrompt");
    if (maxOutputTokens <= 0) {
      throw new IllegalArgumentException("maxOutputTokens must be positive");
    }
  }
}
