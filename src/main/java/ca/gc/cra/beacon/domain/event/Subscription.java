package ca.gc.cra.beacon.domain.event;

import java.util.Objects;

/**
 * Subscription registry entry for one channel.
 *
 * @param channel channel coordinates
 * @param areaDisplay area display name; falls back to the area token
 * @param typeDisplay event type display name; falls back to the type token
 * @param muted whether alerts for this channel are presented silently
 * @param pinned whether the channel is pinned in channel lists
 * @since BEACON 0.1
 */
public record Subscription(
    ChannelId channel, String areaDisplay, String typeDisplay, boolean muted, boolean pinned) {

  /**
   * Applies display-name fallbacks.
   */
  public Subscription {
    Objects.requireNonNull(channel, "channel");
    areaDisplay = areaDisplay == null || areaDisplay.isBlank() ? channel.area() : areaDisplay;
    typeDisplay = typeDisplay == null || typeDisplay.isBlank() ? channel.type() : typeDisplay;
  }

  /**
   * Creates an unmuted, unpinned subscription with token display names.
   *
   * @param channel channel coordinates
   * @return subscription
   */
  public static Subscription of(ChannelId channel) {
    return new Subscription(channel, null, null, false, false);
  }

  /**
   * Returns the channel key.
   *
   * @return {@code "{area}_{type}"}
   */
  public String channelKey() {
    return channel.value();
  }

  /**
   * Returns a copy with a new muted flag.
   *
   * @param value new flag
   * @return updated subscription
   */
  public Subscription withMuted(boolean value) {
    return new Subscription(channel, areaDisplay, typeDisplay, value, pinned);
  }

  /**
   * Returns a copy with a new pinned flag.
   *
   * @param value new flag
   * @return updated subscription
   */
  public Subscription withPinned(boolean value) {
    return new Subscription(channel, areaDisplay, typeDisplay, muted, value);
  }
}
