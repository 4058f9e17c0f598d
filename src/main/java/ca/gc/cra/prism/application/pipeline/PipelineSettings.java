package ca.gc.cra.prism.application.pipeline;

import java.util.Objects;

/**
 * Capacity and policy knobs of a {@link PipelineController}.
 *
 * @param inputQueueCapacity bound of the submit queue
 * @param outputQueueCapacity bound of the output queue
 * @param maxInFlight maximum envelopes processed concurrently
 * @param batchPolicy failure handling inside batch envelopes
 */
public record PipelineSettings(
    int inputQueueCapacity, int outputQueueCapacity, int maxInFlight, BatchPolicy batchPolicy) {
  public static final int DEFAULT_QUEUE_CAPACITY = 100;
  public static final int DEFAULT_MAX_IN_FLIGHT =
      Math.max(2, Runtime.getRuntime().availableProcessors());

  /**
   * Normalizes settings by clamping capacities to at least one and defaulting the batch policy.
   */
  public PipelineSettings {
    inputQueueCapacity = Math.max(1, inputQueueCapacity);
    outputQueueCapacity = Math.max(1, outputQueueCapacity);
    maxInFlight = Math.max(1, maxInFlight);
    batchPolicy = Objects.requireNonNullElse(batchPolicy, BatchPolicy.FAIL_FAST);
  }

  /**
   * Returns the default settings: queues of 100, fail-fast batches.
   *
   * @return default settings
   */
  public static PipelineSettings defaults() {
    return new PipelineSettings(
        DEFAULT_QUEUE_CAPACITY, DEFAULT_QUEUE_CAPACITY, DEFAULT_MAX_IN_FLIGHT, BatchPolicy.FAIL_FAST);
  }

  public PipelineSettings withBatchPolicy(BatchPolicy policy) {
    return new PipelineSettings(inputQueueCapacity, outputQueueCapacity, maxInFlight, policy);
  }
}
