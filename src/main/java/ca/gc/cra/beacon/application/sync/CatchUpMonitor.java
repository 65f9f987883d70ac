package ca.gc.cra.beacon.application.sync;

import ca.gc.cra.beacon.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves channels from catch-up to live mode once their replay has drained.
 *
 * <p>A poll is quiet for a channel when the ingestion pipeline is idle and the channel has accepted at least one
 * event since catch-up began. After {@code quietPollsRequired} consecutive quiet polls the channel goes live; any
 * non-quiet poll resets its count.</p>
 *
 * @since BEACON 0.1
 */
public final class CatchUpMonitor {
  private static final Logger log = LoggerFactory.getLogger(CatchUpMonitor.class);

  private final SequenceTracker tracker;
  private final BooleanSupplier pipelineIdle;
  private final MetricsPort metrics;
  private final int quietPollsRequired;
  private final ConcurrentMap<String, Integer> quietPolls = new ConcurrentHashMap<>();
  private volatile Set<String> lastReportedStuck = Set.of();

  /**
   * Creates a monitor.
   *
   * @param tracker tracker owning the catch-up state
   * @param pipelineIdle reports whether the ingestion queue is empty and no worker is processing
   * @param metrics metrics sink; {@code null} disables metrics
   * @param quietPollsRequired consecutive quiet polls before a channel goes live; must be positive
   */
  public CatchUpMonitor(
      SequenceTracker tracker, BooleanSupplier pipelineIdle, MetricsPort metrics, int quietPollsRequired) {
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    this.pipelineIdle = Objects.requireNonNull(pipelineIdle, "pipelineIdle");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    if (quietPollsRequired <= 0) {
      throw new IllegalArgumentException("quietPollsRequired must be positive");
    }
    this.quietPollsRequired = quietPollsRequired;
  }

  /**
   * Runs one poll.
   *
   * @return channels switched to live mode by this poll
   */
  public List<String> poll() {
    Set<String> catchingUp = tracker.catchUpChannels();
    quietPolls.keySet().retainAll(catchingUp);
    if (catchingUp.isEmpty()) {
      return List.of();
    }
    boolean idle = pipelineIdle.getAsBoolean();
    List<String> completed = new ArrayList<>();
    for (String channel : catchingUp) {
      if (!idle || tracker.catchUpProgress(channel) == 0) {
        quietPolls.remove(channel);
        continue;
      }
      int quiet = quietPolls.merge(channel, 1, Integer::sum);
      if (quiet >= quietPollsRequired) {
        quietPolls.remove(channel);
        if (tracker.disableCatchUpMode(channel)) {
          completed.add(channel);
          metrics.increment("feed.catchup.completed");
        }
      }
    }
    reportStuck();
    return completed;
  }

  int quietPolls(String channel) {
    return quietPolls.getOrDefault(channel, 0);
  }

  private void reportStuck() {
    Map<String, Long> stuck = tracker.stuckChannels();
    if (!stuck.isEmpty() && !stuck.keySet().equals(lastReportedStuck)) {
      log.warn("Channels catching up for more than 30 s: {}", stuck);
    }
    lastReportedStuck = Set.copyOf(stuck.keySet());
  }
}
