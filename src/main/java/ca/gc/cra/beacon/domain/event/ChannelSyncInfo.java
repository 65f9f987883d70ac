package ca.gc.cra.beacon.domain.event;

/**
 * <strong>What:</strong> Snapshot of per-channel synchronization state reported back to the server on subscribe.
 * <p><strong>Why:</strong> Lets the server resume delivery after the last event the client accepted.</p>
 * <p><strong>Thread-safety:</strong> Immutable snapshot; the sequence tracker owns the mutable original.</p>
 *
 * @param lastEventId id of the event that last advanced the high-water mark; {@code null} before any event
 * @param lastEventTimestamp timestamp (seconds) of that event
 * @param lastEventSeq sequence of that event
 * @param highestSeq highest sequence accepted so far; never decreases
 * @param totalReceived number of events accepted on this channel
 * @param lastSyncTime wall-clock millis of the last accepted event
 * @since BEACON 0.1
 */
public record ChannelSyncInfo(
    String lastEventId,
    long lastEventTimestamp,
    long lastEventSeq,
    long highestSeq,
    long totalReceived,
    long lastSyncTime) {

  private static final ChannelSyncInfo EMPTY = new ChannelSyncInfo(null, 0L, 0L, 0L, 0L, 0L);

  /**
   * Returns the state of a channel that has not seen any event.
   *
   * @return empty snapshot
   */
  public static ChannelSyncInfo empty() {
    return EMPTY;
  }

  /**
   * Indicates whether this channel has accepted at least one event.
   *
   * @return {@code true} when the snapshot is worth reporting in a subscription request
   */
  public boolean hasHistory() {
    return totalReceived > 0 || lastEventId != null || highestSeq > 0;
  }
}
