package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.domain.payload.PayloadKind;
import ca.gc.cra.prism.domain.payload.StageSlots;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Aggregates per-envelope and per-slot statistics and forwards them to the
 * {@link MetricsPort}.
 * <p><strong>Thread-safety:</strong> Aggregates are guarded by a single monitor held only for the update;
 * port calls happen outside it.</p>
 * <p><strong>Observability:</strong> Emits {@code pipeline.envelope.*}, {@code pipeline.output.dropped} and
 * the branch error counters.</p>
 *
 * @since 0.1.0
 */
public final class PipelineMetrics {
  private static final double EMA_ALPHA = 0.85d;

  private final MetricsPort port;
  private final Object lock = new Object();
  private final Map<PayloadKind, Long> processed = new EnumMap<>(PayloadKind.class);
  private final long[] branchAAttempts = new long[Branch.A.width()];
  private final long[] branchASuccesses = new long[Branch.A.width()];
  private final long[] branchBAttempts = new long[Branch.B.width()];
  private final long[] branchBSuccesses = new long[Branch.B.width()];
  private long errorCount;
  private long droppedOutputs;
  private long totalLatencyNanos;
  private long latencySamples;
  private double emaLatencyNanos;

  public PipelineMetrics(MetricsPort port) {
    this.port = Objects.requireNonNull(port, "port");
  }

  /**
   * Records a finished envelope.
   *
   * @param kind envelope kind
   * @param latencyNanos processing latency
   * @param failed whether the envelope carries errors
   */
  void recordEnvelope(PayloadKind kind, long latencyNanos, boolean failed) {
    synchronized (lock) {
      processed.merge(kind, 1L, Long::sum);
      if (failed) {
        errorCount++;
      }
      totalLatencyNanos += latencyNanos;
      latencySamples++;
      emaLatencyNanos = latencySamples == 1
          ? latencyNanos
          : EMA_ALPHA * emaLatencyNanos + (1 - EMA_ALPHA) * latencyNanos;
    }
    port.increment(failed ? "pipeline.envelope.failed" : "pipeline.envelope.completed");
    port.observe("pipeline.envelope.latencyNanos", latencyNanos);
  }

  void recordOutputDrop() {
    synchronized (lock) {
      droppedOutputs++;
    }
    port.increment("pipeline.output.dropped");
  }

  /**
   * Records attempts and successes of every slot after a stage joined.
   */
  void recordStage(Branch branch, StageSlots<?> slots) {
    long[] attempts = branch == Branch.A ? branchAAttempts : branchBAttempts;
    long[] successes = branch == Branch.A ? branchASuccesses : branchBSuccesses;
    int failures = 0;
    synchronized (lock) {
      for (int i = 0; i < attempts.length; i++) {
        attempts[i]++;
        if (slots.result(i).isPresent()) {
          successes[i]++;
        } else {
          failures++;
        }
      }
    }
    for (int i = 0; i < failures; i++) {
      port.increment(branch.errorMetric());
    }
  }

  void recordIntegrationFailure() {
    port.increment("pipeline.integration.error");
  }

  /**
   * Returns a copy of the current aggregates.
   *
   * @return snapshot detached from further updates
   */
  public MetricsSnapshot snapshot() {
    synchronized (lock) {
      double average = latencySamples == 0 ? 0d : (double) totalLatencyNanos / latencySamples;
      return new MetricsSnapshot(
          processed,
          errorCount,
          droppedOutputs,
          totalLatencyNanos,
          average,
          emaLatencyNanos,
          utilization(branchAAttempts, branchASuccesses),
          utilization(branchBAttempts, branchBSuccesses));
    }
  }

  private static List<Double> utilization(long[] attempts, long[] successes) {
    List<Double> out = new ArrayList<>(attempts.length);
    for (int i = 0; i < attempts.length; i++) {
      out.add(attempts[i] == 0 ? 0d : (double) successes[i] / attempts[i]);
    }
    return out;
  }
}
