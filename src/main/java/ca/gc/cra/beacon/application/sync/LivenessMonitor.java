package ca.gc.cra.beacon.application.sync;

import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.StateStorePort;
import ca.gc.cra.beacon.application.wire.FeedJson;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects whether the previous run was killed rather than stopped.
 *
 * <p>The running client rewrites a {@code liveness} marker periodically; a clean stop marks it clean. At startup a
 * marker that is not clean and older than the kill gap means the process died without flushing, so stored
 * high-water marks may be ahead of what was actually persisted in the event store.</p>
 *
 * @since BEACON 0.1
 */
public final class LivenessMonitor {
  private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);
  static final String MARKER_KEY = "liveness";

  private final StateStorePort store;
  private final ClockPort clock;
  private final Duration killGap;

  /**
   * Creates a monitor.
   *
   * @param store state store holding the marker
   * @param clock time source
   * @param killGap minimum marker age that counts as a kill
   */
  public LivenessMonitor(StateStorePort store, ClockPort clock, Duration killGap) {
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.killGap = Objects.requireNonNull(killGap, "killGap");
  }

  /**
   * Inspects the marker left by the previous run.
   *
   * @return {@code true} when the previous run ended uncleanly more than the kill gap ago, or the marker cannot be
   *     read
   */
  public boolean detectUncleanShutdown() {
    Optional<String> raw;
    try {
      raw = store.read(MARKER_KEY);
    } catch (IOException ex) {
      log.warn("Liveness marker unreadable; assuming the previous run was killed", ex);
      return true;
    }
    if (raw.isEmpty()) {
      return false;
    }
    JsonNode marker;
    try {
      marker = FeedJson.parse(raw.get());
    } catch (IllegalArgumentException ex) {
      log.warn("Liveness marker malformed; assuming the previous run was killed");
      return true;
    }
    if (marker.path("cleanShutdown").asBoolean(false)) {
      return false;
    }
    long gap = clock.nowMillis() - marker.path("lastAliveMillis").asLong(0L);
    if (gap > killGap.toMillis()) {
      log.warn("Previous run stopped without a clean shutdown {} s ago; entering recovery", gap / 1_000L);
      return true;
    }
    log.info("Previous run stopped uncleanly {} ms ago; within restart gap, no recovery needed", gap);
    return false;
  }

  /**
   * Records that the client is alive.
   */
  public void markAlive() {
    writeMarker(false);
  }

  /**
   * Records a clean stop.
   */
  public void markCleanShutdown() {
    writeMarker(true);
  }

  private void writeMarker(boolean clean) {
    var marker = FeedJson.object();
    marker.put("lastAliveMillis", clock.nowMillis());
    marker.put("cleanShutdown", clean);
    try {
      store.write(MARKER_KEY, FeedJson.write(marker));
    } catch (IOException ex) {
      log.warn("Unable to write liveness marker (clean={})", clean, ex);
    }
  }
}
