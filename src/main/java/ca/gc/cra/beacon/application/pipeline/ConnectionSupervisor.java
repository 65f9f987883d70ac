package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.FeedTransport;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.SubscriptionRegistry;
import ca.gc.cra.beacon.application.sync.SequenceTracker;
import ca.gc.cra.beacon.application.wire.SubscriptionRequest;
import ca.gc.cra.beacon.domain.event.ChannelId;
import ca.gc.cra.beacon.domain.event.ChannelSyncInfo;
import ca.gc.cra.beacon.domain.event.Subscription;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns the feed socket lifecycle: connect, subscribe, heartbeat, and reconnect with linear
 * backoff.
 * <p><strong>Why:</strong> Socket callbacks can report the same disconnect more than once and the user can change
 * subscriptions at any time; the supervisor guarantees a single live connection, a single pending reconnect, and
 * no repeated identical subscription requests.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Send one subscription request per connection after the settle delay, putting every subscribed channel
 *   into catch-up mode and reporting sync state for channels with history.</li>
 *   <li>Schedule at most one reconnect after {@code base * min(attempt, maxMultiplier)}.</li>
 *   <li>Heartbeat: log statistics and detect a silently dead socket.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> State transitions use atomics; subscription sends are serialized.</p>
 * <p><strong>Observability:</strong> Emits {@code feed.connection.*} and {@code feed.subscription.*}.</p>
 *
 * @since BEACON 0.1
 */
public final class ConnectionSupervisor {
  private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

  /** Connection lifecycle states. */
  public enum State {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    STOPPED
  }

  private final FeedTransport transport;
  private final SubscriptionRegistry registry;
  private final SequenceTracker tracker;
  private final Consumer<String> frameSink;
  private final ScheduledExecutorService scheduler;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Settings settings;
  private final String clientId;
  private final Runnable heartbeatAction;

  private final AtomicReference<State> state = new AtomicReference<>(State.DISCONNECTED);
  private final AtomicInteger attempts = new AtomicInteger();
  private final AtomicBoolean subscribed = new AtomicBoolean();
  private final AtomicReference<ScheduledFuture<?>> pendingReconnect = new AtomicReference<>();
  private final AtomicReference<ScheduledFuture<?>> heartbeat = new AtomicReference<>();
  private final Object subscriptionLock = new Object();
  private final SocketListener listener = new SocketListener();

  private String lastRequestJson;
  private long lastRequestAtMillis;

  /**
   * Creates a supervisor.
   *
   * @param transport feed socket
   * @param registry subscription source
   * @param tracker tracker switched to catch-up on every subscription request
   * @param frameSink receives every inbound text frame (the ingestion queue)
   * @param scheduler scheduler for reconnect, settle, and heartbeat timers
   * @param clock time source for duplicate-request suppression
   * @param metrics metrics sink; {@code null} disables metrics
   * @param settings timing settings
   * @param clientId client id sent with subscription requests
   * @param heartbeatAction extra work per heartbeat, typically statistics logging
   */
  public ConnectionSupervisor(
      FeedTransport transport,
      SubscriptionRegistry registry,
      SequenceTracker tracker,
      Consumer<String> frameSink,
      ScheduledExecutorService scheduler,
      ClockPort clock,
      MetricsPort metrics,
      Settings settings,
      String clientId,
      Runnable heartbeatAction) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    this.frameSink = Objects.requireNonNull(frameSink, "frameSink");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clientId = Objects.requireNonNull(clientId, "clientId");
    this.heartbeatAction = Objects.requireNonNullElse(heartbeatAction, () -> {});
  }

  /**
   * Opens a connection unless one is open, opening, or the supervisor was stopped.
   *
   * @return {@code true} when a connection attempt was started
   */
  public boolean connect() {
    if (!state.compareAndSet(State.DISCONNECTED, State.CONNECTING)) {
      log.debug("Connect ignored in state {}", state.get());
      return false;
    }
    cancel(pendingReconnect.getAndSet(null));
    log.info("Connecting to feed server (attempt {})", attempts.get() + 1);
    metrics.increment("feed.connection.attempt");
    try {
      transport.open(listener);
    } catch (RuntimeException ex) {
      handleDisconnect("open failed: " + ex.getMessage(), ex);
    }
    return true;
  }

  /**
   * Stops the supervisor: cancels any reconnect and closes the socket with status 1000.
   */
  public void disconnect() {
    State previous = state.getAndSet(State.STOPPED);
    cancel(pendingReconnect.getAndSet(null));
    stopHeartbeat();
    subscribed.set(false);
    if (previous != State.STOPPED) {
      transport.close(1000, "Client stopped");
      log.info("Disconnected from feed server");
    }
  }

  /**
   * Re-sends the subscription request after the subscription set changed.
   *
   * @return {@code true} when a request was sent
   */
  public boolean updateSubscriptions() {
    if (state.get() != State.CONNECTED) {
      log.debug("Subscription change recorded; will be sent on next connect");
      return false;
    }
    return sendSubscription();
  }

  public State state() {
    return state.get();
  }

  public boolean isConnected() {
    return state.get() == State.CONNECTED;
  }

  public int reconnectAttempts() {
    return attempts.get();
  }

  public boolean reconnectPending() {
    ScheduledFuture<?> future = pendingReconnect.get();
    return future != null && !future.isDone();
  }

  FeedTransport.Listener listener() {
    return listener;
  }

  /**
   * Sends the subscription request once per connection.
   *
   * @return {@code true} when this call sent the request
   */
  boolean sendSubscriptionOnce() {
    if (!subscribed.compareAndSet(false, true)) {
      return false;
    }
    boolean sent = sendSubscription();
    if (!sent) {
      subscribed.set(false);
    }
    return sent;
  }

  /**
   * Builds and sends a subscription request for every current subscription.
   *
   * @return {@code true} when a request was sent; {@code false} when not connected, nothing is subscribed, the
   *     request repeats one sent within the duplicate window, or the send failed
   */
  boolean sendSubscription() {
    synchronized (subscriptionLock) {
      if (state.get() != State.CONNECTED) {
        return false;
      }
      List<Subscription> subscriptions = registry.subscriptions();
      if (subscriptions.isEmpty()) {
        log.info("No channel subscriptions; nothing to request");
        return false;
      }
      List<ChannelId> filters = new ArrayList<>(subscriptions.size());
      Map<String, ChannelSyncInfo> syncState = new LinkedHashMap<>();
      for (Subscription subscription : subscriptions) {
        String channel = subscription.channelKey();
        tracker.enableCatchUpMode(channel);
        filters.add(subscription.channel());
        tracker.syncInfo(channel)
            .filter(ChannelSyncInfo::hasHistory)
            .ifPresent(info -> syncState.put(channel, info));
      }
      SubscriptionRequest request = new SubscriptionRequest(clientId, filters, syncState, syncState.isEmpty());
      String json = request.toJson();
      long now = clock.nowMillis();
      if (json.equals(lastRequestJson)
          && now - lastRequestAtMillis < settings.duplicateSubscriptionWindow().toMillis()) {
        metrics.increment("feed.subscription.suppressed");
        log.debug("Suppressed identical subscription request sent {} ms ago", now - lastRequestAtMillis);
        return false;
      }
      if (!transport.send(json)) {
        metrics.increment("feed.subscription.error");
        log.warn("Subscription request could not be sent; socket not open");
        return false;
      }
      lastRequestJson = json;
      lastRequestAtMillis = now;
      metrics.increment("feed.subscription.sent");
      log.info(
          "Subscribed to {} channels ({} with sync state, resetConsumers={})",
          filters.size(),
          syncState.size(),
          request.resetConsumers());
      return true;
    }
  }

  /**
   * Runs one heartbeat tick.
   */
  void heartbeatTick() {
    try {
      heartbeatAction.run();
    } catch (RuntimeException ex) {
      log.warn("Heartbeat action failed", ex);
    }
    if (state.get() == State.CONNECTED && !transport.isOpen()) {
      metrics.increment("feed.connection.stale");
      handleDisconnect("heartbeat found the socket closed", null);
    }
  }

  private void onOpen() {
    if (!state.compareAndSet(State.CONNECTING, State.CONNECTED)) {
      log.debug("Ignoring open callback in state {}", state.get());
      return;
    }
    attempts.set(0);
    subscribed.set(false);
    metrics.increment("feed.connection.open");
    log.info("Connected to feed server");
    startHeartbeat();
    try {
      scheduler.schedule(this::sendSubscriptionOnce, settings.settleDelay().toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      log.debug("Subscription not scheduled; scheduler is shutting down");
    }
  }

  private void handleDisconnect(String reason, Throwable error) {
    State previous = state.getAndUpdate(current -> current == State.STOPPED ? State.STOPPED : State.DISCONNECTED);
    if (previous == State.STOPPED || previous == State.DISCONNECTED) {
      log.debug("Ignoring duplicate disconnect ({})", reason);
      return;
    }
    stopHeartbeat();
    subscribed.set(false);
    metrics.increment("feed.connection.lost");
    if (error != null) {
      log.warn("Feed connection lost: {}", reason, error);
    } else {
      log.warn("Feed connection lost: {}", reason);
    }
    scheduleReconnect();
  }

  private void scheduleReconnect() {
    int attempt = attempts.incrementAndGet();
    long delay = settings.reconnectBaseDelay().toMillis() * Math.min(attempt, settings.maxBackoffMultiplier());
    try {
      ScheduledFuture<?> future = scheduler.schedule(this::connect, delay, TimeUnit.MILLISECONDS);
      cancel(pendingReconnect.getAndSet(future));
      log.info("Reconnecting in {} ms (attempt {})", delay, attempt);
    } catch (RejectedExecutionException ex) {
      log.debug("Reconnect not scheduled; scheduler is shutting down");
    }
  }

  private void startHeartbeat() {
    long interval = settings.heartbeatInterval().toMillis();
    try {
      ScheduledFuture<?> future =
          scheduler.scheduleAtFixedRate(this::heartbeatTick, interval, interval, TimeUnit.MILLISECONDS);
      cancel(heartbeat.getAndSet(future));
    } catch (RejectedExecutionException ex) {
      log.debug("Heartbeat not scheduled; scheduler is shutting down");
    }
  }

  private void stopHeartbeat() {
    cancel(heartbeat.getAndSet(null));
  }

  private static void cancel(ScheduledFuture<?> future) {
    if (future != null) {
      future.cancel(false);
    }
  }

  /**
   * Connection timing.
   *
   * @param reconnectBaseDelay delay multiplied by the attempt number
   * @param maxBackoffMultiplier cap on the attempt multiplier
   * @param settleDelay delay between open and the subscription request
   * @param duplicateSubscriptionWindow window in which an identical request is suppressed
   * @param heartbeatInterval heartbeat period
   */
  public record Settings(
      Duration reconnectBaseDelay,
      int maxBackoffMultiplier,
      Duration settleDelay,
      Duration duplicateSubscriptionWindow,
      Duration heartbeatInterval) {

    public Settings {
      Objects.requireNonNull(reconnectBaseDelay, "reconnectBaseDelay");
      Objects.requireNonNull(settleDelay, "settleDelay");
      Objects.requireNonNull(duplicateSubscriptionWindow, "duplicateSubscriptionWindow");
      Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
      maxBackoffMultiplier = Math.max(1, maxBackoffMultiplier);
    }

    public static Settings defaults() {
      return new Settings(
          Duration.ofSeconds(5), 12, Duration.ofMillis(500), Duration.ofSeconds(5), Duration.ofSeconds(10));
    }
  }

  private final class SocketListener implements FeedTransport.Listener {
    @Override
    public void onOpen() {
      ConnectionSupervisor.this.onOpen();
    }

    @Override
    public void onMessage(String text) {
      frameSink.accept(text);
    }

    @Override
    public void onClosed(int code, String reason) {
      handleDisconnect("closed with " + code + (reason == null || reason.isEmpty() ? "" : " " + reason), null);
    }

    @Override
    public void onFailure(Throwable error) {
      handleDisconnect(String.valueOf(error.getMessage()), error);
    }
  }
}
