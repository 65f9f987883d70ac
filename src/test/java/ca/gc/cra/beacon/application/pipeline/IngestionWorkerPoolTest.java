package ca.gc.cra.beacon.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.testing.RecordingMetrics;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IngestionWorkerPoolTest {
  private RecordingMetrics metrics;
  private IngestionQueue queue;
  private Set<String> handled;
  private IngestionWorkerPool pool;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetrics();
    queue = new IngestionQueue(metrics);
    handled = ConcurrentHashMap.newKeySet();
    pool = new IngestionWorkerPool(queue, frame -> {
      if (frame.startsWith("bad")) {
        throw new IllegalArgumentException("cannot handle " + frame);
      }
      handled.add(frame);
    }, metrics, 3, Duration.ofMillis(2));
  }

  @AfterEach
  void tearDown() {
    pool.close();
  }

  @Test
  void workersDrainQueueAndSurviveHandlerFailures() throws Exception {
    pool.start();
    for (int i = 0; i < 200; i++) {
      queue.offer(i % 50 == 0 ? "bad-" + i : "frame-" + i);
    }

    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!pool.isIdle() && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }

    assertTrue(pool.isIdle());
    assertEquals(196, handled.size());
    assertEquals(4, metrics.count("feed.worker.error"));
    assertEquals(0, pool.inFlight());
  }

  @Test
  void queueTracksHighWaterMark() {
    queue.offer("a");
    queue.offer("b");
    queue.offer("c");
    queue.poll();

    assertEquals(2, queue.size());
    assertEquals(3, queue.highWaterMark());
    assertEquals(2, queue.clear());
    assertTrue(queue.isEmpty());
  }

  @Test
  void closeDiscardsQueuedFrames() {
    queue.offer("left-behind");
    pool.close();
    assertEquals(1, queue.size());

    pool.start();
    pool.close();
    assertTrue(queue.isEmpty() || handled.contains("left-behind"));
  }

  @Test
  void startTwiceFails() {
    pool.start();
    assertThrows(IllegalStateException.class, pool::start);
  }

  @Test
  void automaticWorkerCountIsBounded() {
    int workers = IngestionWorkerPool.defaultWorkerCount();
    assertTrue(workers >= 4 && workers <= 8);
    assertEquals(workers, new IngestionWorkerPool(queue, f -> {}, metrics, 0, Duration.ofMillis(1)).workerCount());
  }
}
