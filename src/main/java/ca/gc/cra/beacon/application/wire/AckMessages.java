package ca.gc.cra.beacon.application.wire;

import java.util.List;
import java.util.Objects;

/**
 * Builds acknowledgement frames.
 */
public final class AckMessages {
  private AckMessages() {}

  /**
   * Builds {@code {"type":"ack",...}} for one id or {@code {"type":"batch_ack",...}} for several.
   *
   * @param clientId client id
   * @param eventIds ids to acknowledge; must not be empty
   * @return JSON text
   */
  public static String build(String clientId, List<String> eventIds) {
    Objects.requireNonNull(clientId, "clientId");
    if (eventIds == null || eventIds.isEmpty()) {
      throw new IllegalArgumentException("eventIds must not be empty");
    }
    var root = FeedJson.object();
    if (eventIds.size() == 1) {
      root.put("type", "ack");
      root.put("eventId", eventIds.get(0));
    } else {
      root.put("type", "batch_ack");
      var ids = root.putArray("eventIds");
      eventIds.forEach(ids::add);
    }
    root.put("clientId", clientId);
    return FeedJson.write(root);
  }
}
