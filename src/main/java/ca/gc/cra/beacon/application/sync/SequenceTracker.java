package ca.gc.cra.beacon.application.sync;

import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.StateStorePort;
import ca.gc.cra.beacon.application.wire.FeedJson;
import ca.gc.cra.beacon.domain.event.ChannelSyncInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-channel dedup and ordering state machine.
 * <p><strong>Why:</strong> After a reconnect the server replays a backlog in no particular order while new events keep
 * arriving; a plain high-water mark would drop legitimate out-of-order events during that replay.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Catch-up mode: accept an event iff its sequence was not seen since catch-up began.</li>
 *   <li>Live mode: accept an event iff its sequence exceeds the channel's high-water mark.</li>
 *   <li>Advance {@link ChannelSyncInfo} pointers only when the high-water mark moves.</li>
 *   <li>Persist the full snapshot on a debounced timer, or synchronously via {@link #forceSave()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One lock per channel; workers on different channels never contend. Mode switches
 * take the same lock, so a decision always sees a consistent mode.</p>
 * <p><strong>Observability:</strong> Emits {@code feed.sync.accepted}, {@code feed.sync.rejected},
 * {@code feed.sync.save.*}.</p>
 *
 * @since BEACON 0.1
 */
public final class SequenceTracker {
  private static final Logger log = LoggerFactory.getLogger(SequenceTracker.class);
  static final String STATE_KEY = "sync_state";
  private static final Duration STUCK_THRESHOLD = Duration.ofSeconds(30);
  private static final TypeReference<Map<String, ChannelSyncInfo>> SNAPSHOT_TYPE = new TypeReference<>() {};

  private final StateStorePort store;
  private final ScheduledExecutorService scheduler;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Duration saveDelay;

  private final ConcurrentMap<String, SyncEntry> entries = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, CatchUpState> catchUp = new ConcurrentHashMap<>();
  private final AtomicBoolean savePending = new AtomicBoolean();
  private final Object saveLock = new Object();

  /**
   * Creates a tracker.
   *
   * @param store state store holding the {@code sync_state} document
   * @param scheduler scheduler running debounced saves
   * @param clock time source for {@code lastSyncTime} and stuck detection
   * @param metrics metrics sink; {@code null} disables metrics
   * @param saveDelay debounce window for snapshot writes
   */
  public SequenceTracker(
      StateStorePort store,
      ScheduledExecutorService scheduler,
      ClockPort clock,
      MetricsPort metrics,
      Duration saveDelay) {
    this.store = Objects.requireNonNull(store, "store");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.saveDelay = Objects.requireNonNull(saveDelay, "saveDelay");
  }

  /**
   * Loads the persisted snapshot, replacing any in-memory state.
   *
   * @return number of channels restored
   */
  public int load() {
    Optional<String> document;
    try {
      document = store.read(STATE_KEY);
    } catch (IOException ex) {
      log.error("Unable to read sync state; starting without history", ex);
      metrics.increment("feed.sync.load.error");
      return 0;
    }
    entries.clear();
    catchUp.clear();
    if (document.isEmpty()) {
      return 0;
    }
    try {
      Map<String, ChannelSyncInfo> loaded = FeedJson.mapper().readValue(document.get(), SNAPSHOT_TYPE);
      loaded.forEach((channel, info) -> {
        if (info != null) {
          entries.put(channel, SyncEntry.from(info));
        }
      });
    } catch (JsonProcessingException ex) {
      log.error("Discarding unreadable sync state document: {}", ex.getOriginalMessage());
      metrics.increment("feed.sync.load.error");
      return 0;
    }
    long highest = entries.values().stream().mapToLong(e -> e.highestSeq).sum();
    log.info("Loaded sync state for {} channels (sum of high-water marks {})", entries.size(), highest);
    return entries.size();
  }

  /**
   * Decides whether an event is new for its channel and records it when it is.
   *
   * @param channel channel key
   * @param eventId event id
   * @param timestamp event timestamp in seconds
   * @param seq server sequence number; {@code 0} when absent
   * @return {@code true} when the event should proceed to storage
   */
  public boolean recordEventReceived(String channel, String eventId, long timestamp, long seq) {
    Objects.requireNonNull(channel, "channel");
    SyncEntry entry = entries.computeIfAbsent(channel, key -> new SyncEntry());
    long now = clock.nowMillis();
    CatchUpState state;
    synchronized (entry) {
      state = catchUp.get(channel);
      if (seq > 0) {
        boolean accepted = state != null ? state.seen.add(seq) : seq > entry.highestSeq;
        if (!accepted) {
          metrics.increment("feed.sync.rejected");
          return false;
        }
        entry.totalReceived++;
        entry.lastSyncTime = now;
        if (seq > entry.highestSeq) {
          entry.highestSeq = seq;
          entry.lastEventSeq = seq;
          entry.lastEventId = eventId;
          entry.lastEventTimestamp = timestamp;
        }
      } else {
        entry.totalReceived++;
        entry.lastSyncTime = now;
        if (timestamp >= entry.lastEventTimestamp) {
          entry.lastEventTimestamp = timestamp;
          entry.lastEventId = eventId;
        }
      }
    }
    if (state != null) {
      state.progress.increment();
    }
    metrics.increment("feed.sync.accepted");
    scheduleSave();
    return true;
  }

  /**
   * Switches a channel to catch-up mode. Idempotent while the channel is already catching up.
   *
   * @param channel channel key
   */
  public void enableCatchUpMode(String channel) {
    SyncEntry entry = entries.computeIfAbsent(channel, key -> new SyncEntry());
    synchronized (entry) {
      if (catchUp.putIfAbsent(channel, new CatchUpState(clock.nowMillis())) == null) {
        log.debug("Catch-up mode enabled for {}", channel);
      }
    }
  }

  /**
   * Switches a channel to live mode, discarding its catch-up sequence set.
   *
   * @param channel channel key
   * @return {@code true} when the channel was in catch-up mode
   */
  public boolean disableCatchUpMode(String channel) {
    SyncEntry entry = entries.get(channel);
    CatchUpState removed;
    if (entry == null) {
      removed = catchUp.remove(channel);
    } else {
      synchronized (entry) {
        removed = catchUp.remove(channel);
      }
    }
    if (removed == null) {
      return false;
    }
    long elapsed = clock.nowMillis() - removed.enteredAtMillis;
    log.info(
        "{} caught up after {} ms ({} events); {} channels still catching up",
        channel,
        elapsed,
        removed.progress.sum(),
        catchUp.size());
    metrics.observe("feed.sync.catchup.durationMs", elapsed);
    return true;
  }

  /**
   * Puts every channel with history into catch-up mode, used after an unclean process kill.
   *
   * @return number of channels switched
   */
  public int enterRecoveryMode() {
    int switched = 0;
    for (Map.Entry<String, SyncEntry> entry : entries.entrySet()) {
      boolean hasHistory;
      synchronized (entry.getValue()) {
        hasHistory = entry.getValue().snapshot().hasHistory();
      }
      if (hasHistory && !catchUp.containsKey(entry.getKey())) {
        enableCatchUpMode(entry.getKey());
        switched++;
      }
    }
    if (switched > 0) {
      log.warn("Recovery mode: {} previously live channels will dedup through catch-up", switched);
    }
    return switched;
  }

  public boolean isInCatchUpMode(String channel) {
    return catchUp.containsKey(channel);
  }

  public boolean anyInCatchUp() {
    return !catchUp.isEmpty();
  }

  /**
   * Returns the channels currently in catch-up mode.
   *
   * @return sorted snapshot
   */
  public Set<String> catchUpChannels() {
    return new TreeSet<>(catchUp.keySet());
  }

  /**
   * Counts events accepted on {@code channel} since its catch-up began.
   *
   * @param channel channel key
   * @return progress, {@code 0} when the channel is live
   */
  public long catchUpProgress(String channel) {
    CatchUpState state = catchUp.get(channel);
    return state == null ? 0L : state.progress.sum();
  }

  /**
   * Returns a copy of a channel's sync state.
   *
   * @param channel channel key
   * @return snapshot, or empty when the channel has no state
   */
  public Optional<ChannelSyncInfo> syncInfo(String channel) {
    SyncEntry entry = entries.get(channel);
    if (entry == null) {
      return Optional.empty();
    }
    synchronized (entry) {
      return Optional.of(entry.snapshot());
    }
  }

  public long highestSeq(String channel) {
    return syncInfo(channel).map(ChannelSyncInfo::highestSeq).orElse(0L);
  }

  /**
   * Lists channels that have been catching up for longer than 30 seconds.
   *
   * @return channel key to elapsed millis, sorted by key
   */
  public Map<String, Long> stuckChannels() {
    long now = clock.nowMillis();
    Map<String, Long> stuck = new TreeMap<>();
    catchUp.forEach((channel, state) -> {
      long elapsed = now - state.enteredAtMillis;
      if (elapsed > STUCK_THRESHOLD.toMillis()) {
        stuck.put(channel, elapsed);
      }
    });
    return stuck;
  }

  /**
   * Drops all state for one channel (unsubscribe).
   *
   * @param channel channel key
   */
  public void clearChannel(String channel) {
    SyncEntry removed = entries.remove(channel);
    catchUp.remove(channel);
    if (removed != null) {
      log.info("Cleared sync state for {}", channel);
      scheduleSave();
    }
  }

  /**
   * Drops every channel's state and persists the empty snapshot immediately.
   */
  public void clearAll() {
    entries.clear();
    catchUp.clear();
    log.info("Cleared all sync state");
    forceSave();
  }

  /**
   * Summarizes tracker state for periodic statistics logging.
   *
   * @return stats snapshot
   */
  public Stats stats() {
    long total = 0;
    for (SyncEntry entry : entries.values()) {
      synchronized (entry) {
        total += entry.totalReceived;
      }
    }
    return new Stats(entries.size(), catchUp.size(), total);
  }

  /**
   * Writes the snapshot synchronously, bypassing the debounce timer.
   *
   * @return {@code true} when the write succeeded
   */
  public boolean forceSave() {
    savePending.set(false);
    return writeSnapshot();
  }

  private void scheduleSave() {
    if (!savePending.compareAndSet(false, true)) {
      return;
    }
    try {
      scheduler.schedule(this::saveFromTimer, saveDelay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      savePending.set(false);
      log.debug("Sync state save not scheduled; scheduler is shutting down");
    }
  }

  private void saveFromTimer() {
    if (savePending.compareAndSet(true, false)) {
      writeSnapshot();
    }
  }

  private boolean writeSnapshot() {
    synchronized (saveLock) {
      Map<String, ChannelSyncInfo> snapshot = new LinkedHashMap<>();
      for (Map.Entry<String, SyncEntry> entry : new TreeMap<>(entries).entrySet()) {
        synchronized (entry.getValue()) {
          snapshot.put(entry.getKey(), entry.getValue().snapshot());
        }
      }
      try {
        store.write(STATE_KEY, FeedJson.mapper().writeValueAsString(snapshot));
        metrics.increment("feed.sync.save.success");
        return true;
      } catch (IOException ex) {
        metrics.increment("feed.sync.save.error");
        log.warn("Failed to persist sync state for {} channels; will retry on next change",
            snapshot.size(), ex);
        return false;
      }
    }
  }

  /**
   * Tracker summary.
   *
   * @param channels channels with state
   * @param catchingUp channels in catch-up mode
   * @param totalReceived events accepted across all channels
   */
  public record Stats(int channels, int catchingUp, long totalReceived) {}

  private static final class SyncEntry {
    private String lastEventId;
    private long lastEventTimestamp;
    private long lastEventSeq;
    private long highestSeq;
    private long totalReceived;
    private long lastSyncTime;

    static SyncEntry from(ChannelSyncInfo info) {
      SyncEntry entry = new SyncEntry();
      entry.lastEventId = info.lastEventId();
      entry.lastEventTimestamp = info.lastEventTimestamp();
      entry.lastEventSeq = info.lastEventSeq();
      entry.highestSeq = info.highestSeq();
      entry.totalReceived = info.totalReceived();
      entry.lastSyncTime = info.lastSyncTime();
      return entry;
    }

    ChannelSyncInfo snapshot() {
      return new ChannelSyncInfo(
          lastEventId, lastEventTimestamp, lastEventSeq, highestSeq, totalReceived, lastSyncTime);
    }
  }

  private static final class CatchUpState {
    private final Set<Long> seen = ConcurrentHashMap.newKeySet();
    private final LongAdder progress = new LongAdder();
    private final long enteredAtMillis;

    CatchUpState(long enteredAtMillis) {
      this.enteredAtMillis = enteredAtMillis;
    }
  }
}
