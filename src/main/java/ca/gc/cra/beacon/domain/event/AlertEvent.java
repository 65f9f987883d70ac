package ca.gc.cra.beacon.domain.event;

import java.util.Objects;

/**
 * <strong>What:</strong> Immutable operational alert delivered by the feed.
 * <p><strong>Why:</strong> Carries the uniqueness key ({@link #id()}) and channel coordinates used by the sequence
 * tracker and the event store.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share between workers and the UI dispatcher.</p>
 *
 * @param id event identifier, unique within a channel; never blank
 * @param timestamp event time in seconds since the epoch
 * @param area area token
 * @param type event type token
 * @param source originating system or camera; may be {@code null}
 * @param areaDisplay display name of the area; may be {@code null}
 * @param typeDisplay display name of the event type; may be {@code null}
 * @param payload structured payload; never {@code null}
 * @since BEACON 0.1
 */
public record AlertEvent(
    String id,
    long timestamp,
    String area,
    String type,
    String source,
    String areaDisplay,
    String typeDisplay,
    EventPayload payload) {

  /**
   * Validates the identity fields.
   *
   * @throws IllegalArgumentException if the id is blank or the channel tokens are invalid
   */
  public AlertEvent {
    Objects.requireNonNull(id, "id");
    if (id.isBlank()) {
      throw new IllegalArgumentException("id must not be blank");
    }
    ChannelId channel = ChannelId.of(area, type);
    area = channel.area();
    type = channel.type();
    payload = Objects.requireNonNull(payload, "payload");
  }

  /**
   * Returns the channel this event belongs to.
   *
   * @return channel id
   */
  public ChannelId channel() {
    return ChannelId.of(area, type);
  }

  /**
   * Returns the channel key {@code "{area}_{type}"}.
   *
   * @return channel key
   */
  public String channelKey() {
    return area + '_' + type;
  }

  /**
   * Shortcut for {@code payload().sequence()}.
   *
   * @return sequence number, {@code 0} when absent
   */
  public long sequence() {
    return payload.sequence();
  }

  /**
   * Shortcut for {@code payload().requireAck()}.
   *
   * @return whether the server expects an acknowledgement
   */
  public boolean requiresAck() {
    return payload.requireAck();
  }
}
