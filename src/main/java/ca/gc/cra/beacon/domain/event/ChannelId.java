package ca.gc.cra.beacon.domain.event;

import ca.gc.cra.beacon.validation.Strings;

/**
 * Logical channel key derived from an event's area and type, rendered as {@code "{area}_{type}"}.
 *
 * <p>All per-channel state (sync info, catch-up sets, stored events, unread counters) is indexed by
 * {@link #value()}.</p>
 *
 * @param area lower-case area token such as {@code barora}
 * @param type lower-case event type token such as {@code cd}
 * @since BEACON 0.1
 */
public record ChannelId(String area, String type) {
  private static final char SEPARATOR = '_';

  /**
   * Normalizes both tokens.
   *
   * @throws IllegalArgumentException if either token is blank or uses unsupported characters
   */
  public ChannelId {
    area = Strings.requireChannelToken("area", area);
    type = Strings.requireChannelToken("type", type);
  }

  /**
   * Builds a channel id from raw area and type values.
   *
   * @param area area token
   * @param type event type token
   * @return channel id
   */
  public static ChannelId of(String area, String type) {
    return new ChannelId(area, type);
  }

  /**
   * Parses a {@code "{area}_{type}"} key.
   *
   * @param value channel key
   * @return channel id
   * @throws IllegalArgumentException if the key has no separator or either half is invalid
   */
  public static ChannelId parse(String value) {
    String sanitized = Strings.requireNonBlank("channel", value);
    int idx = sanitized.indexOf(SEPARATOR);
    if (idx <= 0 || idx == sanitized.length() - 1) {
      throw new IllegalArgumentException("channel must use {area}_{type} format (was " + sanitized + ")");
    }
    return new ChannelId(sanitized.substring(0, idx), sanitized.substring(idx + 1));
  }

  /**
   * Returns the map key form of this channel.
   *
   * @return {@code "{area}_{type}"}
   */
  public String value() {
    return area + SEPARATOR + type;
  }

  @Override
  public String toString() {
    return value();
  }
}
