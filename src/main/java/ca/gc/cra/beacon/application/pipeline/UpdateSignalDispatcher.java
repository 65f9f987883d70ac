package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.application.port.AlertPresenter;
import ca.gc.cra.beacon.application.port.ChannelUpdateListener;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.SubscriptionRegistry;
import ca.gc.cra.beacon.domain.event.AlertEvent;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Delivers "channel updated" signals to listeners and the alert presenter on one UI thread.
 * <p><strong>Why:</strong> A catch-up replay can store hundreds of events per second; signalling each one would
 * flood the UI with refreshes and notifications.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Live channels: dispatch each stored event immediately.</li>
 *   <li>Catching-up channels: keep only the newest event per channel and dispatch once per batch window.</li>
 *   <li>Present alerts only for unmuted subscriptions.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #publish(AlertEvent)} is called from every worker; deliveries run on the
 * UI executor in submission order.</p>
 *
 * @since BEACON 0.1
 */
public final class UpdateSignalDispatcher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(UpdateSignalDispatcher.class);

  private final Executor uiExecutor;
  private final ScheduledExecutorService scheduler;
  private final Predicate<String> catchingUp;
  private final SubscriptionRegistry registry;
  private final AlertPresenter presenter;
  private final MetricsPort metrics;
  private final Duration batchWindow;

  private final List<ChannelUpdateListener> listeners = new CopyOnWriteArrayList<>();
  private final ConcurrentMap<String, AlertEvent> batched = new ConcurrentHashMap<>();
  private final AtomicBoolean batchFlushScheduled = new AtomicBoolean();

  /**
   * Creates a dispatcher.
   *
   * @param uiExecutor single-threaded executor running deliveries
   * @param scheduler scheduler for batch window flushes
   * @param catchingUp reports whether a channel key is in catch-up mode
   * @param registry subscription lookup for mute state
   * @param presenter alert presenter for unmuted channels
   * @param metrics metrics sink; {@code null} disables metrics
   * @param batchWindow coalescing window for catching-up channels
   */
  public UpdateSignalDispatcher(
      Executor uiExecutor,
      ScheduledExecutorService scheduler,
      Predicate<String> catchingUp,
      SubscriptionRegistry registry,
      AlertPresenter presenter,
      MetricsPort metrics,
      Duration batchWindow) {
    this.uiExecutor = Objects.requireNonNull(uiExecutor, "uiExecutor");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.catchingUp = Objects.requireNonNull(catchingUp, "catchingUp");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.presenter = Objects.requireNonNullElse(presenter, AlertPresenter.NONE);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.batchWindow = Objects.requireNonNull(batchWindow, "batchWindow");
  }

  public void addListener(ChannelUpdateListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(ChannelUpdateListener listener) {
    listeners.remove(listener);
  }

  /**
   * Signals that {@code event} was stored.
   *
   * @param event stored event
   */
  public void publish(AlertEvent event) {
    String channel = event.channelKey();
    if (!catchingUp.test(channel)) {
      dispatch(channel, event);
      return;
    }
    batched.merge(channel, event, (current, next) -> next.timestamp() >= current.timestamp() ? next : current);
    metrics.increment("feed.signal.coalesced");
    if (batchFlushScheduled.compareAndSet(false, true)) {
      try {
        scheduler.schedule(this::flushBatched, batchWindow.toMillis(), TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException ex) {
        batchFlushScheduled.set(false);
        flushBatched();
      }
    }
  }

  /**
   * Dispatches every coalesced signal now.
   *
   * @return number of channels signalled
   */
  public int flushBatched() {
    batchFlushScheduled.set(false);
    int flushed = 0;
    for (String channel : List.copyOf(batched.keySet())) {
      AlertEvent latest = batched.remove(channel);
      if (latest != null) {
        dispatch(channel, latest);
        flushed++;
      }
    }
    return flushed;
  }

  /**
   * Dispatches pending coalesced signals.
   */
  @Override
  public void close() {
    flushBatched();
  }

  private void dispatch(String channel, AlertEvent event) {
    try {
      uiExecutor.execute(() -> deliver(channel, event));
      metrics.increment("feed.signal.dispatched");
    } catch (RejectedExecutionException ex) {
      log.debug("UI executor stopped; dropped update signal for {}", channel);
    }
  }

  private void deliver(String channel, AlertEvent event) {
    for (ChannelUpdateListener listener : listeners) {
      try {
        listener.onChannelUpdated(channel, event);
      } catch (RuntimeException ex) {
        metrics.increment("feed.signal.listener.error");
        log.warn("Channel update listener failed for {}", channel, ex);
      }
    }
    registry.find(channel)
        .filter(subscription -> !subscription.muted())
        .ifPresent(subscription -> {
          try {
            presenter.present(event, subscription);
          } catch (RuntimeException ex) {
            metrics.increment("feed.signal.presenter.error");
            log.warn("Alert presenter failed for {}", channel, ex);
          }
        });
  }
}
