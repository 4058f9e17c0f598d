package ca.gc.cra.prism.domain.payload;

import java.util.Objects;

/**
 * <strong>What:</strong> One entry in an envelope's append-only error list.
 * <p><strong>Why:</strong> Per-item failures are data on the envelope, never exceptions thrown to the
 * submitter.</p>
 * <p><strong>Thread-safety:</strong> Immutable value.</p>
 *
 * @param timestampMillis wall-clock time the error was recorded
 * @param component component that recorded the error (e.g. {@code integration}, {@code batch[2]})
 * @param kind error classification
 * @param step clock step captured at entry of the owning envelope
 * @param message human-readable failure description
 * @since 0.1.0
 */
public record PayloadError(long timestampMillis, String component, ErrorKind kind, int step, String message) {
  public PayloadError {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(kind, "kind");
    message = message == null ? "" : message;
  }

  /**
   * Returns a copy whose component is prefixed with {@code prefix + "/"}.
   *
   * @param prefix component prefix, e.g. {@code batch[1]}
   * @return re-attributed error
   */
  public PayloadError withComponentPrefix(String prefix) {
    return new PayloadError(timestampMillis, prefix + "/" + component, kind, step, message);
  }
}
