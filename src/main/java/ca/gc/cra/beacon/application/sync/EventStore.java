package ca.gc.cra.beacon.application.sync;

import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.StateStorePort;
import ca.gc.cra.beacon.application.wire.AlertEventCodec;
import ca.gc.cra.beacon.application.wire.FeedJson;
import ca.gc.cra.beacon.domain.event.AlertEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-channel store of accepted events with unread counters and a recent-id cache.
 * <p><strong>Why:</strong> The sequence tracker decides "new for this channel"; the store guarantees an event id is
 * stored at most once and keeps the history within the retention window across restarts.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep each channel's events newest first (by timestamp) with a matching id set.</li>
 *   <li>Reject ids already stored or seen within the recent-id window.</li>
 *   <li>Persist with an adaptive debounce: short while catching up or when many changes are pending, long in steady
 *   state, synchronous once the force threshold is reached.</li>
 *   <li>Drop events older than the retention period when {@link #sweepExpired()} runs.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each channel bucket is guarded by its own monitor; persistence is serialized by a
 * single save lock.</p>
 * <p><strong>Observability:</strong> Emits {@code feed.store.added}, {@code feed.store.duplicate},
 * {@code feed.store.expired}, {@code feed.store.save.*}.</p>
 *
 * @since BEACON 0.1
 */
public final class EventStore {
  private static final Logger log = LoggerFactory.getLogger(EventStore.class);
  static final String EVENTS_KEY = "events";
  static final String UNREAD_KEY = "unread";

  private final StateStorePort store;
  private final ScheduledExecutorService scheduler;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Settings settings;
  private final BooleanSupplier catchUpActive;

  private final ConcurrentMap<String, ChannelEvents> channels = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Long> recentIds = new ConcurrentHashMap<>();
  private final AtomicInteger unsaved = new AtomicInteger();
  private final AtomicBoolean savePending = new AtomicBoolean();
  private final Object saveLock = new Object();

  /**
   * Creates a store.
   *
   * @param store state store holding the {@code events} and {@code unread} documents
   * @param scheduler scheduler running debounced saves
   * @param clock time source for retention and the recent-id window
   * @param metrics metrics sink; {@code null} disables metrics
   * @param settings retention and save tuning
   * @param catchUpActive reports whether any channel is catching up; selects the fast save delay
   */
  public EventStore(
      StateStorePort store,
      ScheduledExecutorService scheduler,
      ClockPort clock,
      MetricsPort metrics,
      Settings settings,
      BooleanSupplier catchUpActive) {
    this.store = Objects.requireNonNull(store, "store");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.settings = Objects.requireNonNull(settings, "settings");
    this.catchUpActive = Objects.requireNonNull(catchUpActive, "catchUpActive");
  }

  /**
   * Loads persisted events and unread counters, replacing in-memory state.
   *
   * @param rebuildRecentIds seed the recent-id cache from stored events inside the window; pass {@code false}
   *     after a kill so replayed events are decided by the id sets alone
   * @return number of events restored
   */
  public int load(boolean rebuildRecentIds) {
    channels.clear();
    recentIds.clear();
    int restored = 0;
    int skipped = 0;
    Optional<JsonNode> events = readDocument(EVENTS_KEY);
    if (events.isPresent() && events.get().isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = events.get().fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        ChannelEvents bucket = new ChannelEvents();
        JsonNode stored = field.getValue();
        // Stored newest first; re-insert oldest first so equal timestamps keep their order.
        for (int i = stored.size() - 1; i >= 0; i--) {
          try {
            if (bucket.insert(AlertEventCodec.decode(stored.get(i)))) {
              restored++;
            }
          } catch (IllegalArgumentException ex) {
            skipped++;
          }
        }
        if (!bucket.events.isEmpty()) {
          channels.put(field.getKey(), bucket);
        }
      }
    }
    Optional<JsonNode> unread = readDocument(UNREAD_KEY);
    if (unread.isPresent() && unread.get().isObject()) {
      unread.get().fields().forEachRemaining(field -> {
        ChannelEvents bucket = channels.get(field.getKey());
        if (bucket != null) {
          bucket.unread = Math.max(0, Math.min(field.getValue().asInt(0), bucket.events.size()));
        }
      });
    }
    if (skipped > 0) {
      log.warn("Skipped {} unreadable stored events", skipped);
    }
    int seeded = rebuildRecentIds ? rebuildRecentIdCache() : 0;
    log.info("Loaded {} stored events across {} channels ({} recent ids cached)", restored, channels.size(), seeded);
    return restored;
  }

  /**
   * Stores an event unless its id is already present or was seen within the recent-id window.
   *
   * @param event accepted event
   * @return {@code true} when the event was stored
   */
  public boolean addEvent(AlertEvent event) {
    String channel = event.channelKey();
    String cacheKey = cacheKey(channel, event.id());
    long now = clock.nowMillis();
    ChannelEvents bucket = channels.computeIfAbsent(channel, key -> new ChannelEvents());
    synchronized (bucket) {
      Long seenAt = recentIds.get(cacheKey);
      if (bucket.ids.contains(event.id())
          || (seenAt != null && now - seenAt <= settings.recentIdWindow().toMillis())) {
        metrics.increment("feed.store.duplicate");
        return false;
      }
      bucket.insert(event);
      bucket.unread++;
    }
    recentIds.put(cacheKey, now);
    metrics.increment("feed.store.added");
    int pending = unsaved.incrementAndGet();
    if (pending >= settings.forceSaveThreshold()) {
      saveIfDirty();
    } else {
      scheduleSave(pending);
    }
    return true;
  }

  /**
   * Reports whether an id is stored for a channel.
   *
   * @param channel channel key
   * @param eventId event id
   * @return {@code true} when stored
   */
  public boolean contains(String channel, String eventId) {
    ChannelEvents bucket = channels.get(channel);
    if (bucket == null) {
      return false;
    }
    synchronized (bucket) {
      return bucket.ids.contains(eventId);
    }
  }

  /**
   * Returns a channel's events, newest first.
   *
   * @param channel channel key
   * @return copy of the event list; empty when the channel has none
   */
  public List<AlertEvent> events(String channel) {
    ChannelEvents bucket = channels.get(channel);
    if (bucket == null) {
      return List.of();
    }
    synchronized (bucket) {
      return List.copyOf(bucket.events);
    }
  }

  public Optional<AlertEvent> lastEvent(String channel) {
    ChannelEvents bucket = channels.get(channel);
    if (bucket == null) {
      return Optional.empty();
    }
    synchronized (bucket) {
      return bucket.events.isEmpty() ? Optional.empty() : Optional.of(bucket.events.get(0));
    }
  }

  public int eventCount(String channel) {
    ChannelEvents bucket = channels.get(channel);
    if (bucket == null) {
      return 0;
    }
    synchronized (bucket) {
      return bucket.events.size();
    }
  }

  public int totalEventCount() {
    int total = 0;
    for (String channel : channels.keySet()) {
      total += eventCount(channel);
    }
    return total;
  }

  public int unreadCount(String channel) {
    ChannelEvents bucket = channels.get(channel);
    if (bucket == null) {
      return 0;
    }
    synchronized (bucket) {
      return bucket.unread;
    }
  }

  /**
   * Resets a channel's unread counter.
   *
   * @param channel channel key
   */
  public void markAsRead(String channel) {
    ChannelEvents bucket = channels.get(channel);
    if (bucket == null) {
      return;
    }
    synchronized (bucket) {
      if (bucket.unread == 0) {
        return;
      }
      bucket.unread = 0;
    }
    scheduleSave(unsaved.incrementAndGet());
  }

  /**
   * Removes every event older than the retention period and clamps unread counters.
   *
   * @return number of events removed
   */
  public int sweepExpired() {
    long cutoff = clock.nowSeconds() - settings.retention().toSeconds();
    int removed = 0;
    for (Map.Entry<String, ChannelEvents> entry : channels.entrySet()) {
      ChannelEvents bucket = entry.getValue();
      synchronized (bucket) {
        removed += bucket.removeOlderThan(cutoff);
      }
    }
    if (removed > 0) {
      metrics.observe("feed.store.expired", removed);
      log.info("Retention sweep removed {} events older than {} days", removed, settings.retention().toDays());
      scheduleSave(unsaved.addAndGet(removed));
    }
    return removed;
  }

  /**
   * Forgets recent-id entries older than the window.
   *
   * @return number of entries dropped
   */
  public int pruneRecentIds() {
    long cutoff = clock.nowMillis() - settings.recentIdWindow().toMillis();
    int before = recentIds.size();
    recentIds.values().removeIf(seenAt -> seenAt < cutoff);
    return Math.max(0, before - recentIds.size());
  }

  /**
   * Empties the recent-id cache; called when an unclean kill is detected.
   */
  public void clearRecentIdCache() {
    int size = recentIds.size();
    recentIds.clear();
    log.info("Cleared {} recent-id cache entries", size);
  }

  public int recentIdCacheSize() {
    return recentIds.size();
  }

  /**
   * Drops one channel's events and unread counter (unsubscribe).
   *
   * @param channel channel key
   */
  public void clearChannel(String channel) {
    ChannelEvents removed = channels.remove(channel);
    if (removed != null) {
      log.info("Cleared stored events for {}", channel);
      scheduleSave(unsaved.incrementAndGet());
    }
  }

  /**
   * Drops every event and persists the empty store immediately.
   */
  public void clearAll() {
    channels.clear();
    recentIds.clear();
    log.info("Cleared all stored events");
    forceSave();
  }

  /**
   * Summarizes the store for status output.
   *
   * @return storage stats
   */
  public StorageStats storageStats() {
    Map<String, Integer> perChannel = new TreeMap<>();
    long oldest = Long.MAX_VALUE;
    long newest = Long.MIN_VALUE;
    int unreadTotal = 0;
    for (Map.Entry<String, ChannelEvents> entry : channels.entrySet()) {
      ChannelEvents bucket = entry.getValue();
      synchronized (bucket) {
        if (bucket.events.isEmpty()) {
          continue;
        }
        perChannel.put(entry.getKey(), bucket.events.size());
        newest = Math.max(newest, bucket.events.get(0).timestamp());
        oldest = Math.min(oldest, bucket.events.get(bucket.events.size() - 1).timestamp());
        unreadTotal += bucket.unread;
      }
    }
    int total = perChannel.values().stream().mapToInt(Integer::intValue).sum();
    return new StorageStats(
        perChannel.size(),
        total,
        unreadTotal,
        perChannel,
        perChannel.isEmpty() ? 0L : oldest,
        perChannel.isEmpty() ? 0L : newest);
  }

  /**
   * Writes events and unread counters synchronously.
   *
   * @return {@code true} when both documents were written
   */
  public boolean forceSave() {
    savePending.set(false);
    return write();
  }

  int unsavedChanges() {
    return unsaved.get();
  }

  private void saveIfDirty() {
    if (unsaved.get() > 0) {
      savePending.set(false);
      write();
    }
  }

  private void scheduleSave(int pending) {
    if (!savePending.compareAndSet(false, true)) {
      return;
    }
    Duration delay = catchUpActive.getAsBoolean() || pending >= settings.highUnsavedThreshold()
        ? settings.fastSaveDelay()
        : settings.steadySaveDelay();
    try {
      scheduler.schedule(this::saveFromTimer, delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      savePending.set(false);
      log.debug("Event store save not scheduled; scheduler is shutting down");
    }
  }

  private void saveFromTimer() {
    if (savePending.compareAndSet(true, false)) {
      write();
    }
  }

  private boolean write() {
    synchronized (saveLock) {
      int captured = unsaved.get();
      ObjectNode eventsDoc = FeedJson.object();
      ObjectNode unreadDoc = FeedJson.object();
      for (Map.Entry<String, ChannelEvents> entry : new TreeMap<>(channels).entrySet()) {
        ChannelEvents bucket = entry.getValue();
        synchronized (bucket) {
          if (bucket.events.isEmpty()) {
            continue;
          }
          ArrayNode array = eventsDoc.putArray(entry.getKey());
          bucket.events.forEach(event -> array.add(AlertEventCodec.encode(event)));
          unreadDoc.put(entry.getKey(), bucket.unread);
        }
      }
      try {
        store.write(EVENTS_KEY, FeedJson.write(eventsDoc));
        store.write(UNREAD_KEY, FeedJson.write(unreadDoc));
        unsaved.addAndGet(-captured);
        metrics.increment("feed.store.save.success");
        return true;
      } catch (IOException ex) {
        metrics.increment("feed.store.save.error");
        log.warn("Failed to persist {} pending event store changes", captured, ex);
        return false;
      }
    }
  }

  private Optional<JsonNode> readDocument(String key) {
    try {
      Optional<String> raw = store.read(key);
      if (raw.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(FeedJson.parse(raw.get()));
    } catch (IOException ex) {
      log.error("Unable to read {} document; starting empty", key, ex);
      metrics.increment("feed.store.load.error");
    } catch (IllegalArgumentException ex) {
      log.error("Discarding unreadable {} document: {}", key, ex.getMessage());
      metrics.increment("feed.store.load.error");
    }
    return Optional.empty();
  }

  private int rebuildRecentIdCache() {
    long cutoff = clock.nowMillis() - settings.recentIdWindow().toMillis();
    for (Map.Entry<String, ChannelEvents> entry : channels.entrySet()) {
      for (AlertEvent event : entry.getValue().events) {
        long eventMillis = event.timestamp() * 1_000L;
        if (eventMillis >= cutoff) {
          recentIds.put(cacheKey(entry.getKey(), event.id()), eventMillis);
        }
      }
    }
    return recentIds.size();
  }

  private static String cacheKey(String channel, String eventId) {
    return channel + '|' + eventId;
  }

  /**
   * Retention and save tuning.
   *
   * @param retention age after which events are swept
   * @param recentIdWindow how long an accepted id stays in the recent-id cache
   * @param fastSaveDelay save delay while catching up or when many changes are pending
   * @param steadySaveDelay save delay in steady state
   * @param highUnsavedThreshold pending-change count selecting the fast delay
   * @param forceSaveThreshold pending-change count triggering a synchronous save
   */
  public record Settings(
      Duration retention,
      Duration recentIdWindow,
      Duration fastSaveDelay,
      Duration steadySaveDelay,
      int highUnsavedThreshold,
      int forceSaveThreshold) {

    public Settings {
      Objects.requireNonNull(retention, "retention");
      Objects.requireNonNull(recentIdWindow, "recentIdWindow");
      Objects.requireNonNull(fastSaveDelay, "fastSaveDelay");
      Objects.requireNonNull(steadySaveDelay, "steadySaveDelay");
      if (highUnsavedThreshold <= 0 || forceSaveThreshold <= 0) {
        throw new IllegalArgumentException("save thresholds must be positive");
      }
    }

    public static Settings defaults() {
      return new Settings(
          Duration.ofDays(7), Duration.ofMinutes(5), Duration.ofMillis(250), Duration.ofSeconds(2), 20, 50);
    }
  }

  /**
   * Store summary.
   *
   * @param channels channels holding at least one event
   * @param events events across all channels
   * @param unread unread events across all channels
   * @param perChannel event count per channel key
   * @param oldestTimestamp oldest stored event timestamp in seconds; {@code 0} when empty
   * @param newestTimestamp newest stored event timestamp in seconds; {@code 0} when empty
   */
  public record StorageStats(
      int channels,
      int events,
      int unread,
      Map<String, Integer> perChannel,
      long oldestTimestamp,
      long newestTimestamp) {
    public StorageStats {
      perChannel = Map.copyOf(perChannel);
    }
  }

  private static final class ChannelEvents {
    private final List<AlertEvent> events = new ArrayList<>();
    private final Set<String> ids = new HashSet<>();
    private int unread;

    boolean insert(AlertEvent event) {
      if (!ids.add(event.id())) {
        return false;
      }
      int low = 0;
      int high = events.size();
      while (low < high) {
        int mid = (low + high) >>> 1;
        if (events.get(mid).timestamp() > event.timestamp()) {
          low = mid + 1;
        } else {
          high = mid;
        }
      }
      events.add(low, event);
      return true;
    }

    int removeOlderThan(long cutoffSeconds) {
      int removed = 0;
      for (int i = events.size() - 1; i >= 0 && events.get(i).timestamp() < cutoffSeconds; i--) {
        ids.remove(events.remove(i).id());
        removed++;
      }
      unread = Math.min(unread, events.size());
      return removed;
    }
  }
}
