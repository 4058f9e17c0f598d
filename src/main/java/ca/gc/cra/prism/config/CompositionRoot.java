package ca.gc.cra.prism.config;

import ca.gc.cra.prism.application.pipeline.PipelineController;
import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.port.ReasonerPort;
import ca.gc.cra.prism.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.prism.infrastructure.reasoner.HttpReasonerAdapter;
import ca.gc.cra.prism.infrastructure.reasoner.ReasonerSettings;
import ca.gc.cra.prism.infrastructure.time.CyclingStepClock;
import ca.gc.cra.prism.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.prism.logging.LoggingConfigurator;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires a {@link PipelineController} to its production adapters.
 * <p><strong>Why:</strong> Keeps adapter construction in one place so the pipeline itself depends only
 * on ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Apply logging verbosity.</li>
 *   <li>Create the OpenTelemetry metrics adapter, the HTTP Reasoner and the cycling step clock.</li>
 *   <li>Stop the controller and release adapters on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and close on one thread; the controller itself is
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  static final String API_KEY_ENV = "PRISM_REASONER_API_KEY";

  private final PipelineConfig config;
  private final OpenTelemetryMetricsAdapter metrics;
  private final CyclingStepClock stepClock;
  private final PipelineController controller;

  /**
   * Builds the production graph: OTLP metrics, HTTP Reasoner, ticking step clock.
   *
   * @param config validated configuration
   */
  public CompositionRoot(PipelineConfig config) {
    this(config, new HttpReasonerAdapter(reasonerSettings(Objects.requireNonNull(config, "config"))));
  }

  /**
   * Builds the graph around a caller-supplied Reasoner.
   *
   * @param config validated configuration
   * @param reasoner Reasoner used by every stage
   */
  public CompositionRoot(PipelineConfig config, ReasonerPort reasoner) {
    this.config = Objects.requireNonNull(config, "config");
    Objects.requireNonNull(reasoner, "reasoner");
    if (config.loggingVerbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    this.metrics = new OpenTelemetryMetricsAdapter(config.metricsExporter(), config.metricsEndpoint());
    this.stepClock = new CyclingStepClock();
    ClockPort clock = new SystemClockAdapter();
    this.controller = new PipelineController(config.pipelineSettings(), reasoner, stepClock, clock, metrics);
    log.info("Pipeline composed from {}", config);
  }

  /**
   * Starts the step clock (when a tick period is configured) and the controller.
   */
  public void start() {
    if (config.clockTickMillis() > 0) {
      stepClock.startTicking(Duration.ofMillis(config.clockTickMillis()));
    }
    controller.start();
  }

  public PipelineController controller() {
    return controller;
  }

  public CyclingStepClock stepClock() {
    return stepClock;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public PipelineConfig config() {
    return config;
  }

  @Override
  public void close() {
    if (controller.isRunning()) {
      controller.stop();
    }
    stepClock.close();
    metrics.close();
    log.info("Pipeline resources released");
  }

  private static ReasonerSettings reasonerSettings(PipelineConfig config) {
    ReasonerSettings settings = config.reasonerSettings();
    if (settings.apiKey() == null) {
      String fromEnv = System.getenv(API_KEY_ENV);
      if (fromEnv != null && !fromEnv.isBlank()) {
        return new ReasonerSettings(settings.endpoint(), settings.model(), fromEnv.trim(), settings.requestTimeout());
      }
    }
    return settings;
  }
}
