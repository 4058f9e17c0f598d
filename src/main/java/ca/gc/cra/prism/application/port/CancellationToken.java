package ca.gc.cra.prism.application.port;

/**
 * Cooperative cancellation signal handed to Reasoner calls.
 * <p>The controller fires it on stop; adapters may check it and abort with a {@link ReasonerException}.</p>
 */
@FunctionalInterface
public interface CancellationToken {
  /**
   * Returns whether cancellation was requested.
   *
   * @return {@code true} once the owning pipeline was stopped
   */
  boolean isCancellationRequested();

  /** Token that is never cancelled. */
  CancellationToken NONE = () -> false;
}
