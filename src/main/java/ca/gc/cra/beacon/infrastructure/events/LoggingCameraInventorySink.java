package ca.gc.cra.beacon.infrastructure.events;

import ca.gc.cra.beacon.application.port.CameraInventorySink;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.wire.FeedJson;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the latest camera inventory document and logs its size.
 *
 * @since BEACON 0.1
 */
public final class LoggingCameraInventorySink implements CameraInventorySink {
  private static final Logger log = LoggerFactory.getLogger(LoggingCameraInventorySink.class);

  private final MetricsPort metrics;
  private final AtomicReference<String> latest = new AtomicReference<>();

  public LoggingCameraInventorySink(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void onCameraInventory(String rawCameraJson) {
    latest.set(rawCameraJson);
    metrics.increment("feed.camera.inventory");
    int cameras = countCameras(rawCameraJson);
    if (cameras < 0) {
      log.warn("Received camera inventory that is not a JSON array or object");
    } else {
      log.info("Camera inventory updated: {} cameras", cameras);
    }
  }

  /**
   * Returns the most recent inventory document.
   *
   * @return raw JSON, or {@code null} before the first broadcast
   */
  public String latest() {
    return latest.get();
  }

  static int countCameras(String rawCameraJson) {
    JsonNode root;
    try {
      root = FeedJson.parse(rawCameraJson);
    } catch (IllegalArgumentException ex) {
      return -1;
    }
    if (root.isArray()) {
      return root.size();
    }
    if (root.isObject()) {
      JsonNode cameras = root.path("cameras");
      return cameras.isArray() ? cameras.size() : root.size();
    }
    return -1;
  }
}
