package ca.gc.cra.beacon.application.wire;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Classifies raw text frames from the alert socket.
 *
 * <p>Never throws: every failure is reported as {@link InboundMessage.Kind#MALFORMED} so one bad frame cannot stop
 * a worker.</p>
 */
public final class InboundMessageParser {
  static final String CAMERA_LIST_TYPE = "camera-list";
  static final String RAW_CAMERA_FIELD = "_raw_camera_json";

  /**
   * Parses and classifies one frame.
   *
   * @param raw frame text; {@code null} is malformed
   * @return classified message
   */
  public InboundMessage parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return InboundMessage.malformed("empty frame");
    }
    JsonNode root;
    try {
      root = FeedJson.parse(raw);
    } catch (IllegalArgumentException ex) {
      return InboundMessage.malformed(ex.getMessage());
    }
    if (!root.isObject()) {
      return InboundMessage.malformed("frame is not a JSON object");
    }
    if ("subscribed".equals(root.path("status").asText(null))) {
      return InboundMessage.subscribed();
    }
    JsonNode error = root.get("error");
    if (error != null && !error.isNull()) {
      return InboundMessage.error(error.isTextual() ? error.asText() : error.toString());
    }
    if (CAMERA_LIST_TYPE.equals(root.path("type").asText(null))) {
      JsonNode rawCameras = root.path("data").get(RAW_CAMERA_FIELD);
      if (rawCameras == null || !rawCameras.isTextual()) {
        return InboundMessage.malformed("camera-list frame without " + RAW_CAMERA_FIELD);
      }
      return InboundMessage.cameraList(rawCameras.asText());
    }
    try {
      return InboundMessage.event(AlertEventCodec.decode(root));
    } catch (IllegalArgumentException ex) {
      return InboundMessage.malformed(ex.getMessage());
    }
  }
}
