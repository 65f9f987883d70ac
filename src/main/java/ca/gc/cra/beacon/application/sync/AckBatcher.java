package ca.gc.cra.beacon.application.sync;

import ca.gc.cra.beacon.application.port.FeedTransport;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.wire.AckMessages;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Collects event acknowledgements and sends them in batches.
 * <p><strong>Why:</strong> A catch-up replay can deliver thousands of events; one ack frame per event would double
 * the socket traffic.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Queue ids from any worker without blocking.</li>
 *   <li>Hand a flush to the flush executor once the queue reaches the batch size.</li>
 *   <li>Split a flush into messages of at most {@code min(batchSize, 100)} ids.</li>
 *   <li>Re-queue a chunk whose send failed; the server redelivers anything still unacknowledged.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #enqueue(String)} is lock-free; flushes are serialized.</p>
 * <p><strong>Observability:</strong> Emits {@code feed.ack.sent}, {@code feed.ack.batchSize},
 * {@code feed.ack.requeued}.</p>
 *
 * @since BEACON 0.1
 */
public final class AckBatcher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AckBatcher.class);
  static final int MAX_IDS_PER_MESSAGE = 100;

  private final FeedTransport transport;
  private final String clientId;
  private final Executor flushExecutor;
  private final MetricsPort metrics;
  private final int batchSize;
  private final int chunkSize;

  private final ConcurrentLinkedQueue<String> pending = new ConcurrentLinkedQueue<>();
  private final AtomicInteger pendingCount = new AtomicInteger();
  private final AtomicBoolean thresholdFlushQueued = new AtomicBoolean();
  private final Object flushLock = new Object();

  /**
   * Creates a batcher.
   *
   * @param transport socket used to send ack frames
   * @param clientId client id included in every ack
   * @param flushExecutor executor running size-triggered flushes
   * @param metrics metrics sink; {@code null} disables metrics
   * @param batchSize queue size that triggers a flush; must be positive
   */
  public AckBatcher(
      FeedTransport transport, String clientId, Executor flushExecutor, MetricsPort metrics, int batchSize) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.clientId = Objects.requireNonNull(clientId, "clientId");
    this.flushExecutor = Objects.requireNonNull(flushExecutor, "flushExecutor");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    this.batchSize = batchSize;
    this.chunkSize = Math.min(batchSize, MAX_IDS_PER_MESSAGE);
  }

  /**
   * Queues an acknowledgement.
   *
   * @param eventId acknowledged event id
   */
  public void enqueue(String eventId) {
    pending.offer(Objects.requireNonNull(eventId, "eventId"));
    if (pendingCount.incrementAndGet() >= batchSize && thresholdFlushQueued.compareAndSet(false, true)) {
      try {
        flushExecutor.execute(() -> {
          thresholdFlushQueued.set(false);
          flush();
        });
      } catch (RejectedExecutionException ex) {
        thresholdFlushQueued.set(false);
        log.debug("Ack flush not scheduled; {} acks wait for the next timer flush", pendingCount.get());
      }
    }
  }

  /**
   * Sends every queued ack. Stops at the first failed send and keeps that chunk queued.
   *
   * @return number of ack messages sent
   */
  public int flush() {
    synchronized (flushLock) {
      int messages = 0;
      while (true) {
        List<String> chunk = drain();
        if (chunk.isEmpty()) {
          return messages;
        }
        if (!transport.send(AckMessages.build(clientId, chunk))) {
          chunk.forEach(pending::offer);
          pendingCount.addAndGet(chunk.size());
          metrics.increment("feed.ack.requeued");
          log.debug("Ack send failed; re-queued {} ids", chunk.size());
          return messages;
        }
        messages++;
        metrics.increment("feed.ack.sent");
        metrics.observe("feed.ack.batchSize", chunk.size());
      }
    }
  }

  /**
   * Flush run by the periodic timer; skipped while the socket is down.
   */
  public void flushIfConnected() {
    if (pendingCount.get() > 0 && transport.isOpen()) {
      flush();
    }
  }

  public int pendingCount() {
    return pendingCount.get();
  }

  /**
   * Flushes synchronously before shutdown.
   */
  @Override
  public void close() {
    int sent = flush();
    int left = pendingCount.get();
    if (left > 0) {
      log.info("Stopped with {} unsent acks; the server will redeliver those events", left);
    } else if (sent > 0) {
      log.debug("Final ack flush sent {} messages", sent);
    }
  }

  private List<String> drain() {
    List<String> chunk = new ArrayList<>(chunkSize);
    String id;
    while (chunk.size() < chunkSize && (id = pending.poll()) != null) {
      chunk.add(id);
    }
    pendingCount.addAndGet(-chunk.size());
    return chunk;
  }
}
