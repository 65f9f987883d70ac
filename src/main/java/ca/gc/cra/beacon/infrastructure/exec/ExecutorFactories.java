package ca.gc.cra.beacon.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the executors the feed pipeline runs on: ingestion workers, the shared timer scheduler, and
 * the single UI dispatch thread.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor for long-running ingestion workers.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service; rejects tasks beyond {@code size}
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadFactory factory = threadFactory(prefix, "beacon-worker", false, handler);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds the scheduler shared by debounced saves, ack flushes, heartbeats, and reconnect timers.
   *
   * @param threads core thread count
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler
   * @return scheduler that drops cancelled tasks from its queue
   */
  public static ScheduledExecutorService newScheduler(
      int threads, String prefix, UncaughtExceptionHandler handler) {
    if (threads <= 0) {
      throw new IllegalArgumentException("threads must be positive");
    }
    ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(
        threads, threadFactory(prefix, "beacon-timer", true, handler));
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  /**
   * Builds a single-threaded executor that preserves submission order.
   *
   * @param name thread name
   * @param handler uncaught exception handler
   * @return serial executor
   */
  public static ExecutorService newSerialExecutor(String name, UncaughtExceptionHandler handler) {
    ThreadFactory factory = threadFactory(name, "beacon-serial", true, handler);
    return new ThreadPoolExecutor(
        1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), factory);
  }

  private static ThreadFactory threadFactory(
      String prefix, String fallbackPrefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallbackPrefix : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(
        handler, (t, ex) -> log.error("Thread {} terminated by uncaught exception", t.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
