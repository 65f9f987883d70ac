package ca.gc.cra.beacon.domain.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <strong>What:</strong> Structured body of an alert event.
 * <p><strong>Why:</strong> Known keys are exposed as named fields so the pipeline never probes an untyped map for
 * {@code _seq} or {@code _requireAck}; unknown keys are kept in {@link #extras()} so newer server fields survive a
 * persistence round trip.</p>
 * <p><strong>Thread-safety:</strong> Immutable; map fields are unmodifiable copies.</p>
 *
 * @param sequence server-assigned per-channel sequence number; {@code 0} when absent
 * @param requireAck whether the server expects an acknowledgement ({@code true} when the key is absent)
 * @param location human-readable location; may be {@code null}
 * @param eventTime server-side event time text; may be {@code null}
 * @param geofence geofence descriptor; empty when absent
 * @param vehicle vehicle details; may be {@code null}
 * @param extras every unrecognized payload key in arrival order
 * @since BEACON 0.1
 */
public record EventPayload(
    long sequence,
    boolean requireAck,
    String location,
    String eventTime,
    Map<String, Object> geofence,
    VehicleInfo vehicle,
    Map<String, Object> extras) {

  /**
   * Normalizes the sequence and copies the maps.
   */
  public EventPayload {
    if (sequence < 0) {
      sequence = 0;
    }
    geofence = copy(geofence);
    extras = copy(extras);
  }

  /**
   * Payload carrying only a sequence number and the ack flag.
   *
   * @param sequence sequence number, {@code 0} when absent
   * @param requireAck whether the event must be acknowledged
   * @return minimal payload
   */
  public static EventPayload of(long sequence, boolean requireAck) {
    return new EventPayload(sequence, requireAck, null, null, Map.of(), null, Map.of());
  }

  /**
   * Indicates whether the server assigned a sequence number.
   *
   * @return {@code true} when {@link #sequence()} is positive
   */
  public boolean hasSequence() {
    return sequence > 0;
  }

  private static Map<String, Object> copy(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    // LinkedHashMap tolerates null JSON values and keeps payload order.
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
