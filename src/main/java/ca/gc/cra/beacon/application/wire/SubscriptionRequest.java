package ca.gc.cra.beacon.application.wire;

import ca.gc.cra.beacon.domain.event.ChannelId;
import ca.gc.cra.beacon.domain.event.ChannelSyncInfo;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outbound subscription request.
 *
 * @param clientId stable client id naming the server-side durable consumers
 * @param filters subscribed channels
 * @param syncState last known state per channel key; only channels with history
 * @param resetConsumers {@code true} when no channel contributed sync state
 */
public record SubscriptionRequest(
    String clientId,
    List<ChannelId> filters,
    Map<String, ChannelSyncInfo> syncState,
    boolean resetConsumers) {

  /**
   * Copies collections, preserving filter and sync-state order.
   */
  public SubscriptionRequest {
    Objects.requireNonNull(clientId, "clientId");
    filters = List.copyOf(filters);
    syncState = Collections.unmodifiableMap(new LinkedHashMap<>(syncState));
  }

  /**
   * Serializes to the wire format
   * {@code {"clientId","filters":[{"area","eventType"}],"syncState"?:{...},"resetConsumers"}}.
   *
   * @return JSON text
   */
  public String toJson() {
    var root = FeedJson.object();
    root.put("clientId", clientId);
    var filterArray = root.putArray("filters");
    for (ChannelId channel : filters) {
      var filter = filterArray.addObject();
      filter.put("area", channel.area());
      filter.put("eventType", channel.type());
    }
    if (!syncState.isEmpty()) {
      var state = root.putObject("syncState");
      for (Map.Entry<String, ChannelSyncInfo> entry : syncState.entrySet()) {
        ChannelSyncInfo info = entry.getValue();
        var channelState = state.putObject(entry.getKey());
        if (info.lastEventId() == null) {
          channelState.putNull("lastEventId");
        } else {
          channelState.put("lastEventId", info.lastEventId());
        }
        channelState.put("lastTimestamp", info.lastEventTimestamp());
        channelState.put("lastSeq", info.highestSeq());
      }
    }
    root.put("resetConsumers", resetConsumers);
    return FeedJson.write(root);
  }
}
