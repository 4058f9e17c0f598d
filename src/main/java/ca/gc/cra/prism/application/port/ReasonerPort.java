package ca.gc.cra.prism.application.port;

/**
 * <strong>What:</strong> Port onto the external text generator every pipeline stage delegates to.
 * <p><strong>Why:</strong> The pipeline only orchestrates calls; it never interprets what is generated.</p>
 * <p><strong>Role:</strong> Implemented by {@code HttpReasonerAdapter} in production and by recording
 * doubles in tests.</p>
 * <p><strong>Thread-safety:</strong> Called concurrently from up to seventeen branch tasks per envelope;
 * implementations must be thread-safe.</p>
 * <p><strong>Performance:</strong> May block; the pipeline imposes no timeout of its own.</p>
 *
 * @since 0.1.0
 */
public interface ReasonerPort {
  /**
   * Generates text for {@code prompt}.
   *
   * @param cancellation signal fired when the owning pipeline stops; implementations may abort early
   * @param prompt user prompt
   * @param options system prompt and sampling parameters
   * @return generated text
   * @throws ReasonerException when generation fails or is aborted
   */
  String generate(CancellationToken cancellation, String prompt, GenerateOptions options)
      throws ReasonerException;
}
