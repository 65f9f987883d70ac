package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.beacon.validation.Numbers;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Fixed pool of workers draining the {@link IngestionQueue}.
 * <p>Workers are non-daemon threads named <code>feed-worker-</code>; a worker raises the in-flight count before it
 * polls, so {@link #isIdle()} never reports idle while a frame is between the queue and its handler.</p>
 *
 * @since BEACON 0.1
 */
public final class IngestionWorkerPool implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(IngestionWorkerPool.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final int MIN_AUTO_WORKERS = 4;
  private static final int MAX_AUTO_WORKERS = 8;

  private final IngestionQueue queue;
  private final Consumer<String> handler;
  private final MetricsPort metrics;
  private final int workerCount;
  private final long idleWaitMillis;
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final UncaughtExceptionHandler uncaughtHandler;

  private volatile ExecutorService executor;

  /**
   * Creates a pool; call {@link #start()} to launch the workers.
   *
   * @param queue frame queue
   * @param handler processes one frame; runtime failures are logged and counted
   * @param metrics metrics sink; {@code null} disables metrics
   * @param workers worker count; {@code 0} selects {@link #defaultWorkerCount()}
   * @param idleWait sleep between polls of an empty queue
   */
  public IngestionWorkerPool(
      IngestionQueue queue, Consumer<String> handler, MetricsPort metrics, int workers, Duration idleWait) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.workerCount = workers <= 0 ? defaultWorkerCount() : workers;
    this.idleWaitMillis = Math.max(1L, Objects.requireNonNull(idleWait, "idleWait").toMillis());
    this.uncaughtHandler = this::handleWorkerCrash;
  }

  /**
   * Returns the automatic worker count: available processors clamped to [4, 8].
   *
   * @return worker count
   */
  public static int defaultWorkerCount() {
    return Numbers.clamp(Runtime.getRuntime().availableProcessors(), MIN_AUTO_WORKERS, MAX_AUTO_WORKERS);
  }

  /**
   * Launches the workers.
   *
   * @throws IllegalStateException if already started
   */
  public synchronized void start() {
    if (executor != null) {
      throw new IllegalStateException("Ingestion workers already running");
    }
    stopRequested.set(false);
    ExecutorService pool = ExecutorFactories.newWorkerPool(workerCount, "feed-worker", uncaughtHandler);
    for (int i = 0; i < workerCount; i++) {
      pool.execute(this::workerLoop);
    }
    executor = pool;
    metrics.observe("feed.worker.active", workerCount);
    log.info("Started {} ingestion workers", workerCount);
  }

  /**
   * Reports whether the queue is empty and no frame is being processed.
   *
   * @return {@code true} when idle
   */
  public boolean isIdle() {
    return inFlight.get() == 0 && queue.isEmpty();
  }

  public int inFlight() {
    return inFlight.get();
  }

  public int workerCount() {
    return workerCount;
  }

  /**
   * Stops the workers, waiting for in-flight frames; frames still queued are discarded unacknowledged and are
   * redelivered by the server.
   */
  @Override
  public synchronized void close() {
    ExecutorService pool = executor;
    if (pool == null) {
      return;
    }
    stopRequested.set(true);
    log.info("Stopping ingestion workers");
    pool.shutdown();
    boolean terminated = false;
    try {
      terminated = pool.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        metrics.increment("feed.worker.shutdown.force");
        log.warn("Ingestion workers active after {} ms; forcing shutdown", SHUTDOWN_TIMEOUT.toMillis());
        pool.shutdownNow();
        terminated = pool.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ie) {
      metrics.increment("feed.worker.shutdown.interrupted");
      Thread.currentThread().interrupt();
    }
    if (!terminated) {
      log.error("Ingestion workers failed to terminate cleanly");
    }
    int dropped = queue.clear();
    if (dropped > 0) {
      log.info("Discarded {} unprocessed frames; the server redelivers unacknowledged events", dropped);
    }
    executor = null;
    metrics.observe("feed.worker.active", 0);
    metrics.observe("feed.queue.highWater", queue.highWaterMark());
  }

  private void workerLoop() {
    MDC.put("pipeline", "feed");
    try {
      while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
        inFlight.incrementAndGet();
        String frame = queue.poll();
        if (frame == null) {
          inFlight.decrementAndGet();
          TimeUnit.MILLISECONDS.sleep(idleWaitMillis);
          continue;
        }
        try {
          handler.accept(frame);
        } catch (RuntimeException ex) {
          metrics.increment("feed.worker.error");
          log.error("Ingestion worker failed to process a frame", ex);
        } finally {
          inFlight.decrementAndGet();
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      if (!stopRequested.get()) {
        metrics.increment("feed.worker.interrupted");
      }
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void handleWorkerCrash(Thread thread, Throwable throwable) {
    metrics.increment("feed.worker.uncaught");
    log.error("Ingestion worker {} threw an uncaught exception", thread.getName(), throwable);
  }
}
