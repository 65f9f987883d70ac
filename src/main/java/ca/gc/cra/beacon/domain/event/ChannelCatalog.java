package ca.gc.cra.beacon.domain.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static catalog of the areas and event types the feed publishes.
 *
 * <p>Used to attach display names to subscriptions and to list channels from the CLI. Channels outside the
 * catalog are still accepted; they simply keep their token names.</p>
 */
public final class ChannelCatalog {
  private static final Map<String, String> AREAS = buildAreas();
  private static final Map<String, String> EVENT_TYPES = buildEventTypes();

  private ChannelCatalog() {}

  /**
   * Returns area tokens mapped to display names, in catalog order.
   *
   * @return unmodifiable map
   */
  public static Map<String, String> areas() {
    return AREAS;
  }

  /**
   * Returns event type tokens mapped to display names, in catalog order.
   *
   * @return unmodifiable map
   */
  public static Map<String, String> eventTypes() {
    return EVENT_TYPES;
  }

  /**
   * Returns every area/type combination as an unmuted, unpinned subscription.
   *
   * @return all catalog channels
   */
  public static List<Subscription> allChannels() {
    List<Subscription> channels = new ArrayList<>(AREAS.size() * EVENT_TYPES.size());
    for (Map.Entry<String, String> area : AREAS.entrySet()) {
      for (Map.Entry<String, String> type : EVENT_TYPES.entrySet()) {
        channels.add(new Subscription(
            ChannelId.of(area.getKey(), type.getKey()), area.getValue(), type.getValue(), false, false));
      }
    }
    return Collections.unmodifiableList(channels);
  }

  /**
   * Builds a subscription for {@code channel}, attaching display names when the catalog knows them.
   *
   * @param channel channel coordinates
   * @return subscription with display names
   */
  public static Subscription describe(ChannelId channel) {
    return new Subscription(
        channel, AREAS.get(channel.area()), EVENT_TYPES.get(channel.type()), false, false);
  }

  /**
   * Reports whether both halves of {@code channel} are catalog entries.
   *
   * @param channel channel coordinates
   * @return {@code true} for catalog channels
   */
  public static boolean isKnown(ChannelId channel) {
    return AREAS.containsKey(channel.area()) && EVENT_TYPES.containsKey(channel.type());
  }

  /**
   * Returns the "{area} - {type}" description of a catalog channel.
   *
   * @param channel channel coordinates
   * @return description, or empty for unknown channels
   */
  public static Optional<String> description(ChannelId channel) {
    if (!isKnown(channel)) {
      return Optional.empty();
    }
    return Optional.of(AREAS.get(channel.area()) + " - " + EVENT_TYPES.get(channel.type()));
  }

  private static Map<String, String> buildAreas() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("sijua", "Sijua");
    map.put("kusunda", "Kusunda");
    map.put("bastacolla", "Bastacolla");
    map.put("lodna", "Lodna");
    map.put("govindpur", "Govindpur");
    map.put("barora", "Barora");
    map.put("ccwo", "CCWO");
    map.put("ej", "EJ");
    map.put("cvarea", "CV Area");
    map.put("wjarea", "WJ Area");
    map.put("pbarea", "PB Area");
    map.put("block2", "Block 2");
    map.put("katras", "Katras");
    return Collections.unmodifiableMap(map);
  }

  private static Map<String, String> buildEventTypes() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("cd", "Crowd Detection");
    map.put("vd", "Vehicle Detection");
    map.put("pd", "Person Detection");
    map.put("id", "Intrusion Detection");
    map.put("vc", "Vehicle Congestion");
    map.put("ls", "Loading Status");
    map.put("us", "Unloading Status");
    map.put("ct", "Camera Tampering");
    map.put("sh", "Safety Hazard");
    map.put("ii", "Insufficient Illumination");
    map.put("off-route", "Off-Route Alert");
    map.put("tamper", "Tamper Alert");
    return Collections.unmodifiableMap(map);
  }
}
