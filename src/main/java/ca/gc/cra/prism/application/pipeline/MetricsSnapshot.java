package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.domain.payload.PayloadKind;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Point-in-time copy of the pipeline aggregates.
 * <p><strong>Thread-safety:</strong> Immutable; collections are copied on construction.</p>
 *
 * @param processedByKind envelopes finished per kind
 * @param errorCount envelopes finished with at least one error
 * @param droppedOutputs envelopes dropped because the output queue was full
 * @param totalLatencyNanos summed processing latency
 * @param averageLatencyNanos arithmetic mean latency, 0 before the first sample
 * @param emaLatencyNanos exponential moving average latency
 * @param branchAUtilization per-slot fraction of Branch-A attempts that produced a result
 * @param branchBUtilization per-slot fraction of Branch-B attempts that produced a result
 * @since 0.1.0
 */
public record MetricsSnapshot(
    Map<PayloadKind, Long> processedByKind,
    long errorCount,
    long droppedOutputs,
    long totalLatencyNanos,
    double averageLatencyNanos,
    double emaLatencyNanos,
    List<Double> branchAUtilization,
    List<Double> branchBUtilization) {

  public MetricsSnapshot {
    processedByKind = Map.copyOf(processedByKind);
    branchAUtilization = List.copyOf(branchAUtilization);
    branchBUtilization = List.copyOf(branchBUtilization);
  }

  /**
   * Returns the number of envelopes finished across all kinds.
   *
   * @return total processed
   */
  public long totalProcessed() {
    long total = 0;
    for (long count : processedByKind.values()) {
      total += count;
    }
    return total;
  }

  public long processed(PayloadKind kind) {
    return processedByKind.getOrDefault(kind, 0L);
  }
}
