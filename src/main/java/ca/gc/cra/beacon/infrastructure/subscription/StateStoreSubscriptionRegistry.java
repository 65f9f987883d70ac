package ca.gc.cra.beacon.infrastructure.subscription;

import ca.gc.cra.beacon.application.port.StateStorePort;
import ca.gc.cra.beacon.application.port.SubscriptionRegistry;
import ca.gc.cra.beacon.application.wire.FeedJson;
import ca.gc.cra.beacon.domain.event.ChannelCatalog;
import ca.gc.cra.beacon.domain.event.ChannelId;
import ca.gc.cra.beacon.domain.event.Subscription;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SubscriptionRegistry} persisted as the {@code subscriptions} document.
 *
 * <p>Reads are lock-free against an immutable snapshot; every change is written synchronously before listeners
 * are told about it.</p>
 *
 * @since BEACON 0.1
 */
public final class StateStoreSubscriptionRegistry implements SubscriptionRegistry {
  private static final Logger log = LoggerFactory.getLogger(StateStoreSubscriptionRegistry.class);
  static final String KEY = "subscriptions";

  private final StateStorePort store;
  private final List<Listener> listeners = new CopyOnWriteArrayList<>();
  private volatile Map<String, Subscription> current = Map.of();

  public StateStoreSubscriptionRegistry(StateStorePort store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Loads persisted subscriptions; entries that fail validation are skipped.
   *
   * @return number of subscriptions loaded
   * @throws IOException if the store cannot be read
   */
  public synchronized int load() throws IOException {
    Optional<String> raw = store.read(KEY);
    Map<String, Subscription> loaded = new LinkedHashMap<>();
    if (raw.isPresent()) {
      JsonNode root;
      try {
        root = FeedJson.parse(raw.get());
      } catch (IllegalArgumentException ex) {
        log.warn("Ignoring malformed subscriptions document: {}", ex.getMessage());
        root = FeedJson.mapper().createArrayNode();
      }
      for (JsonNode node : root) {
        try {
          Subscription subscription = new Subscription(
              ChannelId.of(node.path("area").asText(null), node.path("type").asText(null)),
              node.path("areaDisplay").asText(null),
              node.path("typeDisplay").asText(null),
              node.path("muted").asBoolean(false),
              node.path("pinned").asBoolean(false));
          loaded.put(subscription.channelKey(), subscription);
        } catch (IllegalArgumentException | NullPointerException ex) {
          log.warn("Skipping invalid stored subscription {}", node);
        }
      }
    }
    current = Collections.unmodifiableMap(loaded);
    log.info("Loaded {} channel subscriptions", loaded.size());
    return loaded.size();
  }

  @Override
  public List<Subscription> subscriptions() {
    return List.copyOf(current.values());
  }

  @Override
  public Optional<Subscription> find(String channelKey) {
    return Optional.ofNullable(current.get(channelKey));
  }

  public void addListener(Listener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Subscribes to a channel, attaching catalog display names.
   *
   * @param channel channel to add
   * @return {@code true} when newly subscribed
   * @throws IOException if the change cannot be persisted
   */
  public boolean subscribe(ChannelId channel) throws IOException {
    Subscription added;
    synchronized (this) {
      if (current.containsKey(channel.value())) {
        return false;
      }
      added = ChannelCatalog.describe(channel);
      Map<String, Subscription> next = new LinkedHashMap<>(current);
      next.put(added.channelKey(), added);
      persist(next);
    }
    listeners.forEach(listener -> listener.onSubscribed(added));
    return true;
  }

  /**
   * Unsubscribes from a channel.
   *
   * @param channelKey channel key
   * @return {@code true} when the channel was subscribed
   * @throws IOException if the change cannot be persisted
   */
  public boolean unsubscribe(String channelKey) throws IOException {
    synchronized (this) {
      if (!current.containsKey(channelKey)) {
        return false;
      }
      Map<String, Subscription> next = new LinkedHashMap<>(current);
      next.remove(channelKey);
      persist(next);
    }
    listeners.forEach(listener -> listener.onUnsubscribed(channelKey));
    return true;
  }

  public boolean setMuted(String channelKey, boolean muted) throws IOException {
    return update(channelKey, subscription -> subscription.withMuted(muted));
  }

  public boolean setPinned(String channelKey, boolean pinned) throws IOException {
    return update(channelKey, subscription -> subscription.withPinned(pinned));
  }

  private synchronized boolean update(String channelKey, UnaryOperator<Subscription> change) throws IOException {
    Subscription existing = current.get(channelKey);
    if (existing == null) {
      return false;
    }
    Map<String, Subscription> next = new LinkedHashMap<>(current);
    next.put(channelKey, change.apply(existing));
    persist(next);
    return true;
  }

  private void persist(Map<String, Subscription> next) throws IOException {
    ArrayNode array = FeedJson.mapper().createArrayNode();
    for (Subscription subscription : next.values()) {
      var node = array.addObject();
      node.put("area", subscription.channel().area());
      node.put("type", subscription.channel().type());
      node.put("areaDisplay", subscription.areaDisplay());
      node.put("typeDisplay", subscription.typeDisplay());
      node.put("muted", subscription.muted());
      node.put("pinned", subscription.pinned());
    }
    store.write(KEY, FeedJson.write(array));
    current = Collections.unmodifiableMap(next);
  }

  /**
   * Receives subscription set changes after they are persisted.
   */
  public interface Listener {
    void onSubscribed(Subscription subscription);

    void onUnsubscribed(String channelKey);
  }

  /**
   * Returns the current channel keys in subscription order.
   *
   * @return channel keys
   */
  public List<String> channelKeys() {
    return new ArrayList<>(current.keySet());
  }
}
