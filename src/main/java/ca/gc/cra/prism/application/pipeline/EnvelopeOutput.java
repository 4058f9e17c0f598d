package ca.gc.cra.prism.application.pipeline;

import ca.gc.cra.prism.domain.payload.Envelope;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Read side of the bounded output queue. Consumers can only take envelopes out.
 */
public final class EnvelopeOutput {
  private final BlockingQueue<Envelope> queue;

  EnvelopeOutput(BlockingQueue<Envelope> queue) {
    this.queue = Objects.requireNonNull(queue, "queue");
  }

  /**
   * Retrieves the next envelope, waiting up to {@code timeout}.
   *
   * @param timeout maximum wait
   * @return next envelope, or {@code null} on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public Envelope poll(Duration timeout) throws InterruptedException {
    return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  public Envelope poll() {
    return queue.poll();
  }

  public Envelope take() throws InterruptedException {
    return queue.take();
  }

  /**
   * Moves every available envelope into {@code sink}.
   *
   * @param sink destination collection
   * @return number of envelopes moved
   */
  public int drainTo(Collection<? super Envelope> sink) {
    return queue.drainTo(sink);
  }

  public int size() {
    return queue.size();
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }
}
