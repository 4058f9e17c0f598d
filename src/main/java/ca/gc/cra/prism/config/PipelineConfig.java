package ca.gc.cra.prism.config;

import ca.gc.cra.prism.application.pipeline.BatchPolicy;
import ca.gc.cra.prism.application.pipeline.PipelineSettings;
import ca.gc.cra.prism.infrastructure.reasoner.ReasonerSettings;
import ca.gc.cra.prism.validation.Net;
import ca.gc.cra.prism.validation.Numbers;
import ca.gc.cra.prism.validation.Strings;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Validated configuration of a pipeline host: queues, concurrency, batch policy,
 * Reasoner connection, step clock tick, metrics export and logging verbosity.
 * <p><strong>Role:</strong> Built from a flat key/value map (YAML via {@link YamlConfigLoader}, or code)
 * and consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param inputQueueCapacity submit queue bound, {@code 1..65536}
 * @param outputQueueCapacity output queue bound, {@code 1..65536}
 * @param maxInFlight concurrently processed envelopes, {@code 1..256}
 * @param batchPolicy failure handling inside batch envelopes
 * @param reasonerEndpoint HTTP(S) endpoint of the chat-completions service
 * @param reasonerModel model identifier
 * @param reasonerApiKey optional bearer token, {@code null} when unset
 * @param reasonerTimeoutMillis per-request timeout, {@code 1..600000}
 * @param clockTickMillis step clock period; {@code 0} leaves the clock to be advanced manually
 * @param metricsExporter {@code otlp} or {@code none}; {@code null} defers to {@code otel.*} settings
 * @param metricsEndpoint OTLP endpoint; {@code null} defers to {@code otel.*} settings
 * @param loggingVerbose raise the root log level to DEBUG
 * @since 0.1.0
 */
public record PipelineConfig(
    int inputQueueCapacity,
    int outputQueueCapacity,
    int maxInFlight,
    BatchPolicy batchPolicy,
    URI reasonerEndpoint,
    String reasonerModel,
    String reasonerApiKey,
    int reasonerTimeoutMillis,
    int clockTickMillis,
    String metricsExporter,
    String metricsEndpoint,
    boolean loggingVerbose) {
  private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

  public static final String INPUT_QUEUE_CAPACITY = "inputQueueCapacity";
  public static final String OUTPUT_QUEUE_CAPACITY = "outputQueueCapacity";
  public static final String MAX_IN_FLIGHT = "maxInFlight";
  public static final String BATCH_POLICY = "batchPolicy";
  public static final String REASONER_ENDPOINT = "reasoner.endpoint";
  public static final String REASONER_MODEL = "reasoner.model";
  public static final String REASONER_API_KEY = "reasoner.apiKey";
  public static final String REASONER_TIMEOUT_MILLIS = "reasoner.timeoutMillis";
  public static final String CLOCK_TICK_MILLIS = "clock.tickMillis";
  public static final String METRICS_EXPORTER = "metrics.exporter";
  public static final String METRICS_ENDPOINT = "metrics.endpoint";
  public static final String LOGGING_VERBOSE = "logging.verbose";

  private static final Set<String> KNOWN_KEYS = Set.of(
      INPUT_QUEUE_CAPACITY, OUTPUT_QUEUE_CAPACITY, MAX_IN_FLIGHT, BATCH_POLICY,
      REASONER_ENDPOINT, REASONER_MODEL, REASONER_API_KEY, REASONER_TIMEOUT_MILLIS,
      CLOCK_TICK_MILLIS, METRICS_EXPORTER, METRICS_ENDPOINT, LOGGING_VERBOSE);

  private static final int MAX_QUEUE_CAPACITY = 65_536;
  private static final int MAX_IN_FLIGHT_LIMIT = 256;
  private static final int MAX_TIMEOUT_MILLIS = 600_000;
  private static final int MAX_TICK_MILLIS = 60_000;
  private static final int MAX_MODEL_LENGTH = 256;
  private static final String DEFAULT_ENDPOINT = "http://localhost:8080";
  private static final String DEFAULT_MODEL = "local-model";
  private static final int DEFAULT_TIMEOUT_MILLIS = 60_000;
  private static final int DEFAULT_TICK_MILLIS = 1_000;

  public PipelineConfig {
    Numbers.requireRange(INPUT_QUEUE_CAPACITY, inputQueueCapacity, 1, MAX_QUEUE_CAPACITY);
    Numbers.requireRange(OUTPUT_QUEUE_CAPACITY, outputQueueCapacity, 1, MAX_QUEUE_CAPACITY);
    Numbers.requireRange(MAX_IN_FLIGHT, maxInFlight, 1, MAX_IN_FLIGHT_LIMIT);
    Objects.requireNonNull(batchPolicy, BATCH_POLICY);
    Objects.requireNonNull(reasonerEndpoint, REASONER_ENDPOINT);
    Objects.requireNonNull(reasonerModel, REASONER_MODEL);
    Numbers.requireRange(REASONER_TIMEOUT_MILLIS, reasonerTimeoutMillis, 1, MAX_TIMEOUT_MILLIS);
    Numbers.requireRange(CLOCK_TICK_MILLIS, clockTickMillis, 0, MAX_TICK_MILLIS);
  }

  /**
   * Returns the configuration used when no keys are supplied.
   *
   * @return defaults: queues of 100, fail-fast batches, local Reasoner endpoint, one-second clock tick
   */
  public static PipelineConfig defaults() {
    return new PipelineConfig(
        PipelineSettings.DEFAULT_QUEUE_CAPACITY,
        PipelineSettings.DEFAULT_QUEUE_CAPACITY,
        Math.min(MAX_IN_FLIGHT_LIMIT, PipelineSettings.DEFAULT_MAX_IN_FLIGHT),
        BatchPolicy.FAIL_FAST,
        URI.create(DEFAULT_ENDPOINT),
        DEFAULT_MODEL,
        null,
        DEFAULT_TIMEOUT_MILLIS,
        DEFAULT_TICK_MILLIS,
        null,
        null,
        false);
  }

  /**
   * Builds a configuration from flat keys, falling back to {@link #defaults()} for absent or blank ones.
   *
   * @param values flat key/value map; {@code null} is treated as empty
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static PipelineConfig fromMap(Map<String, String> values) {
    Map<String, String> kv = values == null ? Map.of() : values;
    for (String key : kv.keySet()) {
      if (!KNOWN_KEYS.contains(key)) {
        log.warn("Ignoring unknown configuration key '{}'", key);
      }
    }
    PipelineConfig defaults = defaults();
    return new PipelineConfig(
        intValue(kv, INPUT_QUEUE_CAPACITY, defaults.inputQueueCapacity(), 1, MAX_QUEUE_CAPACITY),
        intValue(kv, OUTPUT_QUEUE_CAPACITY, defaults.outputQueueCapacity(), 1, MAX_QUEUE_CAPACITY),
        intValue(kv, MAX_IN_FLIGHT, defaults.maxInFlight(), 1, MAX_IN_FLIGHT_LIMIT),
        present(kv, BATCH_POLICY) ? parseBatchPolicy(kv.get(BATCH_POLICY)) : defaults.batchPolicy(),
        present(kv, REASONER_ENDPOINT)
            ? Net.requireHttpUri(REASONER_ENDPOINT, kv.get(REASONER_ENDPOINT))
            : defaults.reasonerEndpoint(),
        present(kv, REASONER_MODEL)
            ? Strings.requirePrintableAscii(REASONER_MODEL, kv.get(REASONER_MODEL), MAX_MODEL_LENGTH)
            : defaults.reasonerModel(),
        present(kv, REASONER_API_KEY) ? Strings.requireNonBlank(REASONER_API_KEY, kv.get(REASONER_API_KEY)) : null,
        intValue(kv, REASONER_TIMEOUT_MILLIS, defaults.reasonerTimeoutMillis(), 1, MAX_TIMEOUT_MILLIS),
        intValue(kv, CLOCK_TICK_MILLIS, defaults.clockTickMillis(), 0, MAX_TICK_MILLIS),
        present(kv, METRICS_EXPORTER) ? parseExporter(kv.get(METRICS_EXPORTER)) : null,
        present(kv, METRICS_ENDPOINT) ? Net.requireHttpUri(METRICS_ENDPOINT, kv.get(METRICS_ENDPOINT)).toString() : null,
        present(kv, LOGGING_VERBOSE) && Strings.parseFlag(LOGGING_VERBOSE, kv.get(LOGGING_VERBOSE)));
  }

  /**
   * Returns the controller settings portion.
   *
   * @return pipeline settings
   */
  public PipelineSettings pipelineSettings() {
    return new PipelineSettings(inputQueueCapacity, outputQueueCapacity, maxInFlight, batchPolicy);
  }

  /**
   * Returns the Reasoner connection portion.
   *
   * @return reasoner settings
   */
  public ReasonerSettings reasonerSettings() {
    return new ReasonerSettings(
        reasonerEndpoint, reasonerModel, reasonerApiKey, Duration.ofMillis(reasonerTimeoutMillis));
  }

  @Override
  public String toString() {
    return "PipelineConfig[inputQueueCapacity=" + inputQueueCapacity
        + ", outputQueueCapacity=" + outputQueueCapacity
        + ", maxInFlight=" + maxInFlight
        + ", batchPolicy=" + batchPolicy
        + ", reasonerEndpoint=" + reasonerEndpoint
        + ", reasonerModel=" + reasonerModel
        + ", reasonerTimeoutMillis=" + reasonerTimeoutMillis
        + ", clockTickMillis=" + clockTickMillis
        + ", metricsExporter=" + metricsExporter
        + ", loggingVerbose=" + loggingVerbose + "]";
  }

  private static boolean present(Map<String, String> kv, String key) {
    String value = kv.get(key);
    return value != null && !value.isBlank();
  }

  private static int intValue(Map<String, String> kv, String key, int fallback, int min, int max) {
    return present(kv, key) ? Numbers.parseBoundedInt(key, kv.get(key), min, max) : fallback;
  }

  private static BatchPolicy parseBatchPolicy(String raw) {
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    try {
      return BatchPolicy.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          BATCH_POLICY + " must be FAIL_FAST or CONTINUE_ON_ERROR (was '" + raw + "')", ex);
    }
  }

  private static String parseExporter(String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException(METRICS_EXPORTER + " must be otlp or none (was '" + raw + "')");
    }
    return normalized;
  }
}
