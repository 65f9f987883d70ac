package ca.gc.cra.beacon.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ca.gc.cra.beacon.testing.RecordingMetrics;
import org.junit.jupiter.api.Test;

class LoggingCameraInventorySinkTest {

  @Test
  void keepsLatestInventory() {
    RecordingMetrics metrics = new RecordingMetrics();
    LoggingCameraInventorySink sink = new LoggingCameraInventorySink(metrics);
    assertNull(sink.latest());

    sink.onCameraInventory("[{\"id\":1}]");
    sink.onCameraInventory("{\"cameras\":[{\"id\":1},{\"id\":2}]}");

    assertEquals("{\"cameras\":[{\"id\":1},{\"id\":2}]}", sink.latest());
    assertEquals(2, metrics.count("feed.camera.inventory"));
  }

  @Test
  void countsCamerasInSupportedShapes() {
    assertEquals(2, LoggingCameraInventorySink.countCameras("[1,2]"));
    assertEquals(3, LoggingCameraInventorySink.countCameras("{\"cameras\":[1,2,3]}"));
    assertEquals(2, LoggingCameraInventorySink.countCameras("{\"a\":{},\"b\":{}}"));
    assertEquals(-1, LoggingCameraInventorySink.countCameras("\"text\""));
    assertEquals(-1, LoggingCameraInventorySink.countCameras("{broken"));
  }
}
