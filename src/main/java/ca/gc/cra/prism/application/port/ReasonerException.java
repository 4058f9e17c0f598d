package ca.gc.cra.prism.application.port;

/**
 * Signals that a Reasoner call failed or was aborted.
 */
public class ReasonerException extends Exception {
  private static final long serialVersionUID = 1L;

  public ReasonerException(String message) {
    super(message);
  }

  public ReasonerException(String message, Throwable cause) {
    super(message, cause);
  }
}
