package ca.gc.cra.prism.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("prism.metric.key");

  @Test
  void countersAccumulateUnderSanitizedNames() {
    InMemoryMetricReader reader = InMemoryMetricReader.create();
    try (OpenTelemetryMetricsAdapter adapter =
        new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader))) {
      assertFalse(adapter.isNoop());
      adapter.increment("pipeline.submit.accepted");
      adapter.increment("pipeline.submit.accepted");
      adapter.forceFlush();

      MetricData metric = find(reader.collectAllMetrics(), "pipeline.submit.accepted");
      assertEquals(MetricDataType.LONG_SUM, metric.getType());
      LongPointData point = metric.getLongSumData().getPoints().iterator().next();
      assertEquals(2, point.getValue());
      assertEquals("pipeline.submit.accepted", point.getAttributes().get(METRIC_KEY));
      assertEquals("prism", metric.getResource().getAttribute(AttributeKey.stringKey("service.name")));
      assertEquals(OpenTelemetryBootstrap.INSTRUMENTATION_SCOPE, metric.getInstrumentationScopeInfo().getName());
    }
  }

  @Test
  void observationsRecordHistograms() {
    InMemoryMetricReader reader = InMemoryMetricReader.create();
    try (OpenTelemetryMetricsAdapter adapter =
        new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader))) {
      adapter.observe("pipeline.envelope.latencyNanos", 100);
      adapter.observe("pipeline.envelope.latencyNanos", 300);
      adapter.forceFlush();

      MetricData metric = find(reader.collectAllMetrics(), "pipeline.envelope.latencynanos");
      assertEquals(MetricDataType.HISTOGRAM, metric.getType());
      HistogramPointData point = metric.getHistogramData().getPoints().iterator().next();
      assertEquals(2, point.getCount());
      assertEquals(400d, point.getSum());
    }
  }

  @Test
  void namesAreSanitized() {
    assertEquals("pipeline.branch_a", OpenTelemetryMetricsAdapter.sanitizeName("Pipeline.Branch A"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("prism.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void noneExporterFallsBackToNoop() {
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter("none", null)) {
      assertTrue(adapter.isNoop());
      adapter.increment("pipeline.submit.accepted");
      adapter.observe("pipeline.inflight", 3);
    }
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported: " + metrics));
  }
}
