package ca.gc.cra.prism.application.port;

/**
 * <strong>What:</strong> Port abstracting pipeline metrics emission.
 * <p><strong>Why:</strong> Lets the controller and stages record counters and latency observations
 * without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from submitter,
 * envelope and branch threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g.
 * {@code pipeline.envelope.latencyNanos}).</p>
 *
 * @implNote Callers never pass {@code null} keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric key (e.g. {@code pipeline.output.dropped}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric key; must not be {@code null}
   * @param value observed value (nanoseconds, counts); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
