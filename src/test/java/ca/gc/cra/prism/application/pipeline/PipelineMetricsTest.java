package ca.gc.cra.prism.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.prism.domain.payload.PayloadKind;
import ca.gc.cra.prism.domain.payload.PerspectiveResult;
import ca.gc.cra.prism.domain.payload.StageSlots;
import org.junit.jupiter.api.Test;

class PipelineMetricsTest {
  private final RecordingMetricsPort port = new RecordingMetricsPort();
  private final PipelineMetrics metrics = new PipelineMetrics(port);

  @Test
  void emptySnapshotHasZeroedAggregates() {
    MetricsSnapshot snapshot = metrics.snapshot();

    assertEquals(0, snapshot.totalProcessed());
    assertEquals(0d, snapshot.averageLatencyNanos());
    assertEquals(0d, snapshot.emaLatencyNanos());
    assertEquals(8, snapshot.branchAUtilization().size());
    assertEquals(9, snapshot.branchBUtilization().size());
  }

  @Test
  void emaIsSeededWithFirstSample() {
    metrics.recordEnvelope(PayloadKind.TOKEN, 1_000, false);
    assertEquals(1_000d, metrics.snapshot().emaLatencyNanos());

    metrics.recordEnvelope(PayloadKind.TOKEN, 2_000, true);
    MetricsSnapshot snapshot = metrics.snapshot();
    assertEquals(0.85d * 1_000 + 0.15d * 2_000, snapshot.emaLatencyNanos(), 1e-9);
    assertEquals(1_500d, snapshot.averageLatencyNanos(), 1e-9);
    assertEquals(3_000, snapshot.totalLatencyNanos());
    assertEquals(1, snapshot.errorCount());
    assertEquals(2, snapshot.processed(PayloadKind.TOKEN));
    assertEquals(1, port.count("pipeline.envelope.completed"));
    assertEquals(1, port.count("pipeline.envelope.failed"));
  }

  @Test
  void snapshotIsDetachedFromLaterUpdates() {
    metrics.recordEnvelope(PayloadKind.GRAPH, 10, false);
    MetricsSnapshot before = metrics.snapshot();

    metrics.recordEnvelope(PayloadKind.GRAPH, 10, false);
    metrics.recordOutputDrop();

    assertEquals(1, before.processed(PayloadKind.GRAPH));
    assertEquals(0, before.droppedOutputs());
    assertThrows(UnsupportedOperationException.class, () -> before.processedByKind().put(PayloadKind.TOKEN, 1L));
    assertEquals(2, metrics.snapshot().processed(PayloadKind.GRAPH));
  }

  @Test
  void stageUtilizationTracksPerSlotSuccessRate() {
    StageSlots<PerspectiveResult> first = new StageSlots<>("branchA", 8);
    StageSlots<PerspectiveResult> second = new StageSlots<>("branchA", 8);
    for (int i = 0; i < 8; i++) {
      first.complete(i, new PerspectiveResult(i, "d", "000", "t", PerspectiveResult.DEFAULT_CONFIDENCE));
      if (i == 3) {
        second.fail(i, "d", new IllegalStateException("x"));
      } else {
        second.complete(i, new PerspectiveResult(i, "d", "000", "t", PerspectiveResult.DEFAULT_CONFIDENCE));
      }
    }

    metrics.recordStage(Branch.A, first);
    metrics.recordStage(Branch.A, second);

    MetricsSnapshot snapshot = metrics.snapshot();
    assertEquals(0.5d, snapshot.branchAUtilization().get(3));
    assertEquals(1d, snapshot.branchAUtilization().get(0));
    assertEquals(1, port.count("pipeline.branchA.error"));
  }
}
