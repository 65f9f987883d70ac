package ca.gc.cra.beacon.application.wire;

import ca.gc.cra.beacon.domain.event.AlertEvent;
import ca.gc.cra.beacon.domain.event.EventPayload;
import ca.gc.cra.beacon.domain.event.VehicleInfo;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Converts between the feed's event JSON shape and {@link AlertEvent}.
 *
 * <p>The same shape is used on the wire and in the persisted event store:
 * {@code {"id","timestamp","area","type","source"?,"areaDisplay"?,"typeDisplay"?,"data":{...}}}. Inside {@code data},
 * {@code _seq}, {@code _requireAck}, {@code location}, {@code eventTime}, {@code geofence}, {@code vehicleNumber} and
 * {@code vehicleTransporter} map to named payload fields; every other key lands in the extras map.</p>
 */
public final class AlertEventCodec {
  static final String SEQ = "_seq";
  static final String REQUIRE_ACK = "_requireAck";
  private static final Set<String> KNOWN_DATA_KEYS = Set.of(
      SEQ, REQUIRE_ACK, "location", "eventTime", "geofence", "vehicleNumber", "vehicleTransporter");
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private AlertEventCodec() {}

  /**
   * Decodes an event object.
   *
   * <p>A missing or unparseable {@code timestamp} decodes as {@code 0}; numeric strings are accepted. An
   * unparseable {@code _seq} decodes as unsequenced.</p>
   *
   * @param node JSON object carrying an event
   * @return decoded event
   * @throws IllegalArgumentException if {@code id}, {@code area} or {@code type} is missing
   */
  public static AlertEvent decode(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("event must be a JSON object");
    }
    String id = requireText(node, "id");
    String area = requireText(node, "area");
    String type = requireText(node, "type");
    JsonNode data = node.path("data");
    EventPayload payload = decodePayload(node, data.isObject() ? data : FeedJson.object());
    return new AlertEvent(
        id,
        lenientLong(node.get("timestamp")),
        area,
        type,
        optionalText(node, "source"),
        optionalText(node, "areaDisplay"),
        optionalText(node, "typeDisplay"),
        payload);
  }

  /**
   * Encodes an event into its JSON object form.
   *
   * @param event event to encode
   * @return object node
   */
  public static ObjectNode encode(AlertEvent event) {
    ObjectNode node = FeedJson.object();
    node.put("id", event.id());
    node.put("timestamp", event.timestamp());
    node.put("area", event.area());
    node.put("type", event.type());
    putIfPresent(node, "source", event.source());
    putIfPresent(node, "areaDisplay", event.areaDisplay());
    putIfPresent(node, "typeDisplay", event.typeDisplay());

    EventPayload payload = event.payload();
    ObjectNode data = node.putObject("data");
    if (payload.hasSequence()) {
      data.put(SEQ, payload.sequence());
    }
    data.put(REQUIRE_ACK, payload.requireAck());
    putIfPresent(data, "location", payload.location());
    putIfPresent(data, "eventTime", payload.eventTime());
    if (!payload.geofence().isEmpty()) {
      data.set("geofence", FeedJson.mapper().valueToTree(payload.geofence()));
    }
    VehicleInfo vehicle = payload.vehicle();
    if (vehicle != null) {
      putIfPresent(data, "vehicleNumber", vehicle.number());
      putIfPresent(data, "vehicleTransporter", vehicle.transporter());
    }
    for (Map.Entry<String, Object> extra : payload.extras().entrySet()) {
      data.set(extra.getKey(), FeedJson.mapper().valueToTree(extra.getValue()));
    }
    return node;
  }

  private static EventPayload decodePayload(JsonNode event, JsonNode data) {
    long sequence = Math.max(0L, lenientLong(data.get(SEQ)));
    JsonNode ackNode = data.get(REQUIRE_ACK);
    boolean requireAck = ackNode == null || ackNode.isNull() || ackNode.asBoolean(true);

    Map<String, Object> geofence = Map.of();
    JsonNode geofenceNode = data.get("geofence");
    if (geofenceNode != null && geofenceNode.isObject()) {
      geofence = FeedJson.mapper().convertValue(geofenceNode, MAP_TYPE);
    }

    String vehicleNumber = firstText(data, event, "vehicleNumber");
    String vehicleTransporter = firstText(data, event, "vehicleTransporter");
    VehicleInfo vehicle = new VehicleInfo(vehicleNumber, vehicleTransporter);

    Map<String, Object> extras = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!KNOWN_DATA_KEYS.contains(field.getKey())) {
        extras.put(field.getKey(), FeedJson.mapper().convertValue(field.getValue(), Object.class));
      }
    }

    return new EventPayload(
        sequence,
        requireAck,
        optionalText(data, "location"),
        optionalText(data, "eventTime"),
        geofence,
        vehicle.isEmpty() ? null : vehicle,
        extras);
  }

  /** Number or numeric string; anything else is {@code 0}. */
  private static long lenientLong(JsonNode node) {
    if (node == null || node.isNull()) {
      return 0L;
    }
    if (node.isNumber() && node.canConvertToLong()) {
      return node.asLong();
    }
    if (node.isTextual()) {
      try {
        return Long.parseLong(node.asText().trim());
      } catch (NumberFormatException ex) {
        return 0L;
      }
    }
    return 0L;
  }

  private static String requireText(JsonNode node, String field) {
    String value = optionalText(node, field);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("event is missing '" + field + "'");
    }
    return value;
  }

  private static String optionalText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.isContainerNode()) {
      return null;
    }
    return value.asText();
  }

  private static String firstText(JsonNode primary, JsonNode secondary, String field) {
    String value = optionalText(primary, field);
    return value != null ? value : optionalText(secondary, field);
  }

  private static void putIfPresent(ObjectNode node, String field, String value) {
    if (value != null) {
      node.put(field, value);
    }
  }
}
