package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.domain.event.IngestOutcome;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Running counters for the ingestion path, logged on every heartbeat and at shutdown.
 *
 * @since BEACON 0.1
 */
public final class FeedStats {
  private final LongAdder received = new LongAdder();
  private final LongAdder acksQueued = new LongAdder();
  private final Map<IngestOutcome, LongAdder> outcomes = new EnumMap<>(IngestOutcome.class);

  public FeedStats() {
    for (IngestOutcome outcome : IngestOutcome.values()) {
      outcomes.put(outcome, new LongAdder());
    }
  }

  void frameReceived() {
    received.increment();
  }

  void ackQueued() {
    acksQueued.increment();
  }

  void record(IngestOutcome outcome) {
    outcomes.get(outcome).increment();
  }

  /**
   * Captures the current counters.
   *
   * @return immutable snapshot
   */
  public Snapshot snapshot() {
    return new Snapshot(
        received.sum(),
        outcomes.get(IngestOutcome.ACCEPTED).sum(),
        outcomes.get(IngestOutcome.DUPLICATE).sum(),
        outcomes.get(IngestOutcome.DROPPED_UNSUBSCRIBED).sum(),
        outcomes.get(IngestOutcome.MALFORMED).sum() + outcomes.get(IngestOutcome.SERVER_ERROR).sum(),
        acksQueued.sum());
  }

  /**
   * Counter snapshot.
   *
   * @param received frames taken off the queue
   * @param accepted events stored
   * @param duplicates events rejected as already seen
   * @param dropped events for unsubscribed channels
   * @param errors malformed frames and server error frames
   * @param acksQueued acknowledgements handed to the batcher
   */
  public record Snapshot(
      long received, long accepted, long duplicates, long dropped, long errors, long acksQueued) {
    @Override
    public String toString() {
      return "received=" + received
          + " accepted=" + accepted
          + " duplicates=" + duplicates
          + " dropped=" + dropped
          + " errors=" + errors
          + " acks=" + acksQueued;
    }
  }
}
