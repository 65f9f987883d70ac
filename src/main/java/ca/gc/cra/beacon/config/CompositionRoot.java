package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.application.pipeline.FeedClient;
import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.StateStorePort;
import ca.gc.cra.beacon.application.sync.ClientIdProvider;
import ca.gc.cra.beacon.application.sync.EventStore;
import ca.gc.cra.beacon.application.sync.SequenceTracker;
import ca.gc.cra.beacon.domain.event.ChannelId;
import ca.gc.cra.beacon.domain.event.Subscription;
import ca.gc.cra.beacon.infrastructure.events.LoggingAlertPresenter;
import ca.gc.cra.beacon.infrastructure.events.LoggingCameraInventorySink;
import ca.gc.cra.beacon.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.beacon.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.beacon.infrastructure.persistence.FileStateStore;
import ca.gc.cra.beacon.infrastructure.subscription.StateStoreSubscriptionRegistry;
import ca.gc.cra.beacon.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.beacon.infrastructure.transport.OkHttpFeedTransport;
import ca.gc.cra.beacon.validation.Paths;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the feed client to its concrete adapters.
 * <p><strong>Why:</strong> Keeps every translation from {@link FeedConfig} to runnable objects in one place.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the file state store under the configured state directory.</li>
 *   <li>Load subscriptions and add the configured startup channels.</li>
 *   <li>Build the {@link FeedClient} with the OkHttp transport, OpenTelemetry metrics, and logging sinks.</li>
 *   <li>Release adapter resources once the client is closed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use from the CLI thread; {@link #close()} may run from a shutdown
 * hook.</p>
 *
 * @since BEACON 0.1
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final FeedConfig config;
  private final ClockPort clock;
  private final Supplier<String> hostName;
  private StateStorePort stateStore;
  private OpenTelemetryMetricsAdapter metrics;
  private OkHttpFeedTransport transport;
  private FeedClient client;

  /**
   * Creates a composition root using the system clock and local host name.
   *
   * @param config effective configuration; must not be {@code null}
   */
  public CompositionRoot(FeedConfig config) {
    this(config, new SystemClockAdapter(), CompositionRoot::localHostName);
  }

  /**
   * Creates a composition root with explicit clock and host name sources.
   *
   * @param config effective configuration
   * @param clock time source shared by all components
   * @param hostName supplies the host token used when creating a client id
   */
  public CompositionRoot(FeedConfig config, ClockPort clock, Supplier<String> hostName) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.hostName = Objects.requireNonNull(hostName, "hostName");
  }

  /**
   * Returns the state store, creating the state directory on first use.
   *
   * @return file-backed state store
   * @throws IllegalArgumentException if the state directory is not usable
   */
  public synchronized StateStorePort stateStore() {
    if (stateStore == null) {
      stateStore = new FileStateStore(Paths.validateStateDir(config.stateDir(), true));
    }
    return stateStore;
  }

  public ClientIdProvider clientIds() {
    return new ClientIdProvider(stateStore(), hostName);
  }

  /**
   * Loads persisted subscriptions and subscribes the configured startup channels.
   *
   * @return loaded registry
   * @throws IOException if subscriptions cannot be read or written
   */
  public StateStoreSubscriptionRegistry subscriptionRegistry() throws IOException {
    StateStoreSubscriptionRegistry registry = new StateStoreSubscriptionRegistry(stateStore());
    registry.load();
    for (ChannelId channel : config.channels()) {
      if (registry.subscribe(channel)) {
        log.info("Added startup channel {}", channel.value());
      }
    }
    return registry;
  }

  /**
   * Builds the feed client, wiring registry changes into the running connection.
   *
   * @return client ready for {@link FeedClient#start()}
   * @throws IOException if the client id or subscriptions cannot be loaded
   * @throws IllegalStateException if called twice
   */
  public synchronized FeedClient feedClient() throws IOException {
    if (client != null) {
      throw new IllegalStateException("Feed client already built");
    }
    StateStoreSubscriptionRegistry registry = subscriptionRegistry();
    String clientId = clientIds().getOrCreate();
    metrics = OpenTelemetryMetricsAdapter.create(config.metricsExporter(), config.otelEndpoint());
    transport = new OkHttpFeedTransport(config.serverUri(), config.pingInterval());
    FeedClient built = new FeedClient(
        config.settings(),
        transport,
        stateStore(),
        registry,
        new LoggingCameraInventorySink(metrics),
        new LoggingAlertPresenter(metrics),
        clock,
        metrics,
        clientId);
    registry.addListener(new StateStoreSubscriptionRegistry.Listener() {
      @Override
      public void onSubscribed(Subscription subscription) {
        built.channelSubscribed(subscription.channelKey());
      }

      @Override
      public void onUnsubscribed(String channelKey) {
        built.channelUnsubscribed(channelKey);
      }
    });
    if (registry.subscriptions().isEmpty()) {
      log.warn("No channels subscribed; pass channels=area_type,... to receive alerts");
    }
    log.info("Feed client {} wired for {} ({} channels)", clientId, config.serverUri(),
        registry.subscriptions().size());
    client = built;
    return built;
  }

  /**
   * Loads persisted sync state and events without connecting.
   *
   * @return summary of the state directory
   * @throws IOException if the client id or subscriptions cannot be read
   */
  public StatusReport statusReport() throws IOException {
    StateStorePort store = stateStore();
    ScheduledExecutorService scheduler = ExecutorFactories.newScheduler(1, "status-timer", null);
    try {
      SequenceTracker tracker =
          new SequenceTracker(store, scheduler, clock, MetricsPort.NO_OP, config.settings().syncSaveDelay());
      tracker.load();
      EventStore events =
          new EventStore(store, scheduler, clock, MetricsPort.NO_OP, config.settings().store(), () -> false);
      events.load(false);
      StateStoreSubscriptionRegistry registry = new StateStoreSubscriptionRegistry(store);
      registry.load();
      return new StatusReport(
          clientIds().current().orElse(null),
          registry.subscriptions(),
          tracker.stats(),
          events.storageStats());
    } finally {
      scheduler.shutdownNow();
    }
  }

  /**
   * Stops the client if one was built and releases the transport and metrics resources.
   */
  @Override
  public synchronized void close() {
    if (client != null) {
      client.close();
    }
    if (transport != null) {
      transport.shutdown();
    }
    if (metrics != null) {
      metrics.close();
    }
  }

  static String localHostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Unable to resolve local host name", ex);
      return "host";
    }
  }

  /**
   * Snapshot of persisted client state.
   *
   * @param clientId persisted client id, or {@code null} when none exists yet
   * @param subscriptions stored subscriptions
   * @param sync sync tracker summary
   * @param storage stored event summary
   */
  public record StatusReport(
      String clientId,
      List<Subscription> subscriptions,
      SequenceTracker.Stats sync,
      EventStore.StorageStats storage) {

    public StatusReport {
      subscriptions = List.copyOf(subscriptions);
    }
  }
}
