package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.application.port.MetricsPort;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Unbounded FIFO of raw frames between the socket callback thread and the ingestion workers.
 *
 * <p>The socket thread must never block, so offers always succeed; depth and its high-water mark are tracked for
 * statistics.</p>
 *
 * @since BEACON 0.1
 */
public final class IngestionQueue {
  private final ConcurrentLinkedQueue<String> frames = new ConcurrentLinkedQueue<>();
  private final AtomicInteger depth = new AtomicInteger();
  private final AtomicInteger highWaterMark = new AtomicInteger();
  private final MetricsPort metrics;

  public IngestionQueue(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Appends a raw frame.
   *
   * @param frame frame text
   */
  public void offer(String frame) {
    frames.offer(Objects.requireNonNull(frame, "frame"));
    int current = depth.incrementAndGet();
    metrics.increment("feed.queue.enqueued");
    updateHighWater(current);
  }

  /**
   * Removes the oldest frame.
   *
   * @return frame, or {@code null} when empty
   */
  public String poll() {
    String frame = frames.poll();
    if (frame != null) {
      depth.decrementAndGet();
    }
    return frame;
  }

  public boolean isEmpty() {
    return frames.isEmpty();
  }

  public int size() {
    return Math.max(0, depth.get());
  }

  public int highWaterMark() {
    return highWaterMark.get();
  }

  /**
   * Discards every queued frame.
   *
   * @return number of frames discarded
   */
  public int clear() {
    int dropped = 0;
    while (poll() != null) {
      dropped++;
    }
    return dropped;
  }

  private void updateHighWater(int current) {
    int previous;
    do {
      previous = highWaterMark.get();
      if (current <= previous) {
        return;
      }
    } while (!highWaterMark.compareAndSet(previous, current));
    metrics.observe("feed.queue.highWater", current);
  }
}
