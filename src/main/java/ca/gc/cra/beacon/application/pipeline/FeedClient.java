package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.application.port.AlertPresenter;
import ca.gc.cra.beacon.application.port.CameraInventorySink;
import ca.gc.cra.beacon.application.port.ChannelUpdateListener;
import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.FeedTransport;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.StateStorePort;
import ca.gc.cra.beacon.application.port.SubscriptionRegistry;
import ca.gc.cra.beacon.application.sync.AckBatcher;
import ca.gc.cra.beacon.application.sync.CatchUpMonitor;
import ca.gc.cra.beacon.application.sync.EventStore;
import ca.gc.cra.beacon.application.sync.LivenessMonitor;
import ca.gc.cra.beacon.application.sync.SequenceTracker;
import ca.gc.cra.beacon.infrastructure.exec.ExecutorFactories;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the alert feed client: restores state, connects, ingests, and shuts down cleanly.
 * <p>Instances are not reusable; {@link #start()} at most once, then {@link #close()}. Background work runs on a
 * shared timer scheduler (threads named <code>feed-timer-</code>), the ingestion workers, and a single UI dispatch
 * thread.</p>
 *
 * @since BEACON 0.1
 */
public final class FeedClient implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(FeedClient.class);
  private static final Duration RECENT_ID_PRUNE_INTERVAL = Duration.ofMinutes(1);
  private static final Duration SCHEDULER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

  private final Settings settings;
  private final MetricsPort metrics;
  private final ScheduledExecutorService scheduler;
  private final ExecutorService uiExecutor;
  private final SequenceTracker tracker;
  private final EventStore store;
  private final AckBatcher acks;
  private final IngestionQueue queue;
  private final IngestionWorkerPool workers;
  private final UpdateSignalDispatcher signals;
  private final CatchUpMonitor catchUpMonitor;
  private final LivenessMonitor liveness;
  private final ConnectionSupervisor supervisor;
  private final FeedStats stats = new FeedStats();
  private final FeedMessageProcessor processor;

  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final List<ScheduledFuture<?>> periodicTasks = new ArrayList<>();

  /**
   * Wires the client.
   *
   * @param settings tuning
   * @param transport feed socket
   * @param stateStore durable state
   * @param registry subscriptions
   * @param cameras camera inventory sink
   * @param presenter alert presenter
   * @param clock time source
   * @param metrics metrics sink; {@code null} disables metrics
   * @param clientId stable client id
   */
  public FeedClient(
      Settings settings,
      FeedTransport transport,
      StateStorePort stateStore,
      SubscriptionRegistry registry,
      CameraInventorySink cameras,
      AlertPresenter presenter,
      ClockPort clock,
      MetricsPort metrics,
      String clientId) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    UncaughtExceptionHandler crashHandler = this::handleBackgroundCrash;
    this.scheduler = ExecutorFactories.newScheduler(2, "feed-timer", crashHandler);
    this.uiExecutor = ExecutorFactories.newSerialExecutor("feed-ui", crashHandler);
    this.tracker = new SequenceTracker(stateStore, scheduler, clock, this.metrics, settings.syncSaveDelay());
    this.store = new EventStore(
        stateStore, scheduler, clock, this.metrics, settings.store(), tracker::anyInCatchUp);
    this.acks = new AckBatcher(transport, clientId, scheduler, this.metrics, settings.ackBatchSize());
    this.queue = new IngestionQueue(this.metrics);
    this.signals = new UpdateSignalDispatcher(
        uiExecutor,
        scheduler,
        tracker::isInCatchUpMode,
        registry,
        presenter,
        this.metrics,
        settings.signalBatchWindow());
    this.processor = new FeedMessageProcessor(
        new FeedContext(tracker, store, acks, registry, signals, cameras, this.metrics), stats);
    this.workers = new IngestionWorkerPool(
        queue, processor::accept, this.metrics, settings.workers(), settings.workerIdleWait());
    this.catchUpMonitor = new CatchUpMonitor(tracker, workers::isIdle, this.metrics, settings.catchUpQuietPolls());
    this.liveness = new LivenessMonitor(stateStore, clock, settings.killDetectionGap());
    this.supervisor = new ConnectionSupervisor(
        transport,
        registry,
        tracker,
        queue::offer,
        scheduler,
        clock,
        this.metrics,
        settings.connection(),
        clientId,
        this::logStats);
  }

  /**
   * Restores persisted state, starts background work, and opens the connection.
   *
   * @throws IllegalStateException if already started or closed
   */
  public void start() {
    if (closed.get()) {
      throw new IllegalStateException("Feed client already closed");
    }
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Feed client already started");
    }
    boolean killed = liveness.detectUncleanShutdown();
    tracker.load();
    store.load(true);
    if (killed) {
      store.clearRecentIdCache();
      tracker.enterRecoveryMode();
      metrics.increment("feed.recovery.entered");
    }
    liveness.markAlive();
    store.sweepExpired();

    workers.start();
    schedule(acks::flushIfConnected, settings.ackFlushInterval());
    schedule(this::pollCatchUp, settings.catchUpPollInterval());
    schedule(liveness::markAlive, settings.livenessInterval());
    schedule(store::sweepExpired, settings.retentionSweepInterval());
    schedule(store::pruneRecentIds, RECENT_ID_PRUNE_INTERVAL);
    supervisor.connect();
    log.info("Feed client started");
  }

  /**
   * Called after a channel was subscribed.
   *
   * @param channelKey new channel
   */
  public void channelSubscribed(String channelKey) {
    log.info("Subscribed to {}", channelKey);
    supervisor.updateSubscriptions();
  }

  /**
   * Called after a channel was unsubscribed; drops its sync state and stored events.
   *
   * @param channelKey removed channel
   */
  public void channelUnsubscribed(String channelKey) {
    tracker.clearChannel(channelKey);
    store.clearChannel(channelKey);
    log.info("Unsubscribed from {}", channelKey);
    supervisor.updateSubscriptions();
  }

  public void addUpdateListener(ChannelUpdateListener listener) {
    signals.addListener(listener);
  }

  public void markAsRead(String channelKey) {
    store.markAsRead(channelKey);
  }

  public SequenceTracker tracker() {
    return tracker;
  }

  public EventStore store() {
    return store;
  }

  public ConnectionSupervisor supervisor() {
    return supervisor;
  }

  public FeedStats.Snapshot stats() {
    return stats.snapshot();
  }

  /**
   * Stops the client: workers drain, acks flush, the socket closes, and all state is written synchronously.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (!started.get()) {
      shutdown(scheduler, "timer");
      shutdown(uiExecutor, "UI dispatch");
      return;
    }
    log.info("Stopping feed client");
    periodicTasks.forEach(task -> task.cancel(false));
    periodicTasks.clear();
    workers.close();
    acks.close();
    supervisor.disconnect();
    signals.close();
    tracker.forceSave();
    store.forceSave();
    liveness.markCleanShutdown();
    shutdown(scheduler, "timer");
    shutdown(uiExecutor, "UI dispatch");
    logStats();
    log.info("Feed client stopped");
  }

  private void pollCatchUp() {
    List<String> live = catchUpMonitor.poll();
    if (!live.isEmpty()) {
      tracker.forceSave();
    }
  }

  private void logStats() {
    SequenceTracker.Stats trackerStats = tracker.stats();
    log.info(
        "Feed stats: {} queue={} inFlight={} pendingAcks={} channels={} catchingUp={} stored={}",
        stats.snapshot(),
        queue.size(),
        workers.inFlight(),
        acks.pendingCount(),
        trackerStats.channels(),
        trackerStats.catchingUp(),
        store.totalEventCount());
  }

  private void schedule(Runnable task, Duration interval) {
    long millis = interval.toMillis();
    periodicTasks.add(scheduler.scheduleWithFixedDelay(() -> {
      try {
        task.run();
      } catch (RuntimeException ex) {
        metrics.increment("feed.timer.error");
        log.error("Periodic feed task failed", ex);
      }
    }, millis, millis, TimeUnit.MILLISECONDS));
  }

  private void shutdown(ExecutorService executor, String name) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SCHEDULER_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("{} executor active after {} ms; forcing shutdown", name, SCHEDULER_SHUTDOWN_TIMEOUT.toMillis());
        executor.shutdownNow();
      }
    } catch (InterruptedException ie) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private void handleBackgroundCrash(Thread thread, Throwable throwable) {
    metrics.increment("feed.thread.uncaught");
    log.error("Feed thread {} threw an uncaught exception", thread.getName(), throwable);
  }

  /**
   * Client tuning.
   *
   * @param workers ingestion worker count; {@code 0} for automatic
   * @param workerIdleWait worker sleep on an empty queue
   * @param ackBatchSize acks per size-triggered flush
   * @param ackFlushInterval periodic ack flush interval
   * @param syncSaveDelay sync state save debounce
   * @param store event store tuning
   * @param connection connection timing
   * @param catchUpPollInterval catch-up monitor period
   * @param catchUpQuietPolls consecutive quiet polls before a channel goes live
   * @param signalBatchWindow UI signal coalescing window during catch-up
   * @param retentionSweepInterval retention sweep period
   * @param killDetectionGap marker age that counts as an unclean kill
   * @param livenessInterval liveness marker refresh period
   */
  public record Settings(
      int workers,
      Duration workerIdleWait,
      int ackBatchSize,
      Duration ackFlushInterval,
      Duration syncSaveDelay,
      EventStore.Settings store,
      ConnectionSupervisor.Settings connection,
      Duration catchUpPollInterval,
      int catchUpQuietPolls,
      Duration signalBatchWindow,
      Duration retentionSweepInterval,
      Duration killDetectionGap,
      Duration livenessInterval) {

    public Settings {
      Objects.requireNonNull(workerIdleWait, "workerIdleWait");
      Objects.requireNonNull(ackFlushInterval, "ackFlushInterval");
      Objects.requireNonNull(syncSaveDelay, "syncSaveDelay");
      Objects.requireNonNull(store, "store");
      Objects.requireNonNull(connection, "connection");
      Objects.requireNonNull(catchUpPollInterval, "catchUpPollInterval");
      Objects.requireNonNull(signalBatchWindow, "signalBatchWindow");
      Objects.requireNonNull(retentionSweepInterval, "retentionSweepInterval");
      Objects.requireNonNull(killDetectionGap, "killDetectionGap");
      Objects.requireNonNull(livenessInterval, "livenessInterval");
    }

    public static Settings defaults() {
      return new Settings(
          0,
          Duration.ofMillis(5),
          50,
          Duration.ofMillis(100),
          Duration.ofMillis(500),
          EventStore.Settings.defaults(),
          ConnectionSupervisor.Settings.defaults(),
          Duration.ofSeconds(5),
          3,
          Duration.ofMillis(500),
          Duration.ofHours(6),
          Duration.ofMinutes(2),
          Duration.ofMinutes(1));
    }
  }
}
